package io.hhplus.ticketing.application.usecase.ticket;

import io.hhplus.ticketing.application.ticket.dto.IssueTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketResponse;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketResult;
import io.hhplus.ticketing.application.usecase.UseCase;
import io.hhplus.ticketing.domain.ticket.Ticket;
import io.hhplus.ticketing.infrastructure.metrics.TicketMetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * 티켓 발권 UseCase
 * <p>
 * 멱등성 보장 (Idempotency-Key 헤더가 있을 때):
 * - 동일 키 + 동일 본문 + 완료: 캐시된 응답 반환 (티켓 추가 생성 없음)
 * - 동일 키 + 동일 본문 + 처리 중: 409
 * - 동일 키 + 다른 본문: 409
 * - 실패했던 키: 새 요청으로 재처리
 * <p>
 * 원자성:
 * - TicketIssueService.issue() 한 트랜잭션에서 quantity장 생성
 * - 실패 시 롤백 + 멱등성 키 FAILED (응답 캐싱 안 함, Error 포함)
 * - 성공 시 커밋 이후 응답 캐싱
 * - 결과는 예약 ID로 기록하므로, TTL이 지나 같은 키가 다른 요청에 재예약되었다면 반영되지 않는다.
 * <p>
 * 이 클래스 자체는 트랜잭션을 열지 않는다. 커밋 전에 응답을 캐싱하면
 * 커밋 실패 시 존재하지 않는 티켓 ID가 재전송될 수 있기 때문이다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class IssueTicketUseCase {

    private final TicketIdempotencyService idempotencyService;
    private final TicketIssueService ticketIssueService;
    private final TicketMetricsCollector metricsCollector;

    public IssueTicketResult execute(IssueTicketRequest request, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        log.info("Issuing tickets. userId: {}, theater: {}, movie: {}, quantity: {}, idempotencyKey: {}",
                request.userId(), request.theaterName(), request.movieTitle(), request.quantity(), idempotencyKey);

        // 1. 입력 검증 (멱등성 키를 예약하기 전에)
        Ticket.validateIssuable(
                request.theaterName(),
                request.userId(),
                request.movieTitle(),
                request.priceKrw(),
                request.quantity()
        );

        // 2. 멱등성 키 확인
        boolean idempotent = StringUtils.hasText(idempotencyKey);
        String reservationId = null;
        if (idempotent) {
            TicketIdempotencyService.Reservation reservation = idempotencyService.reserve(idempotencyKey, request);
            if (reservation.isReplay()) {
                return IssueTicketResult.replayed(reservation.cachedResponse());
            }
            reservationId = reservation.reservationId();
        }

        // 3. 발권 (단일 트랜잭션)
        IssueTicketResponse response;
        try {
            response = ticketIssueService.issue(request);
        } catch (RuntimeException | Error e) {
            log.error("Ticket issue failed. userId: {}, idempotencyKey: {}, error: {}",
                    request.userId(), idempotencyKey, e.getMessage());
            if (idempotent) {
                idempotencyService.fail(idempotencyKey, reservationId, e.getMessage());
            }
            metricsCollector.recordIssueFailure();
            throw e;
        }

        // 4. 커밋 이후 응답 캐싱
        if (idempotent) {
            idempotencyService.complete(idempotencyKey, reservationId, response);
        }

        metricsCollector.recordIssueSuccess(response.count(), startTime);
        log.info("Tickets issued successfully. count: {}, ticketIds: {}, idempotencyKey: {}",
                response.count(), response.ticketIds(), idempotencyKey);
        return IssueTicketResult.created(response);
    }
}
