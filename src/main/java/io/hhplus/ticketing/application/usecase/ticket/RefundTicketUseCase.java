package io.hhplus.ticketing.application.usecase.ticket;

import io.hhplus.ticketing.application.ticket.dto.RefundTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.RefundTicketResponse;
import io.hhplus.ticketing.application.usecase.UseCase;
import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;
import io.hhplus.ticketing.domain.ticket.Ticket;
import io.hhplus.ticketing.domain.ticket.TicketRepository;
import io.hhplus.ticketing.infrastructure.metrics.TicketMetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 티켓 환불 UseCase
 * <p>
 * 요청된 ID마다 현재 상태를 보고 세 가지 중 하나로 분류한다.
 * - 저장소에 없음 → notFound
 * - CANCELED → alreadyCanceled
 * - ISSUED → CANCELED 전이 + 취소 시각 기록 → refunded
 * <p>
 * - 단일 트랜잭션: 실패 시 어떤 티켓도 취소되지 않는다.
 * - 일괄 조회 1회 (Pessimistic Lock, N+1 없음)
 * - 같은 ID가 여러 번 오면 요청 순서대로 최신 상태를 보고 분류한다.
 *   (첫 번째는 refunded, 반복분은 alreadyCanceled)
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class RefundTicketUseCase {

    private final TicketRepository ticketRepository;
    private final TicketMetricsCollector metricsCollector;
    private final Clock clock;

    @Transactional
    public RefundTicketResponse execute(RefundTicketRequest request) {
        if (request.ticketIds() == null || request.ticketIds().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "환불할 티켓 ID는 최소 1개 이상이어야 합니다");
        }
        log.info("Refunding tickets. requested: {}, reason: {}", request.ticketIds().size(), request.reason());

        // 1. 중복 제거 후 한 번에 조회
        LinkedHashSet<String> uniqueIds = new LinkedHashSet<>(request.ticketIds());
        Map<String, Ticket> ticketsById = ticketRepository.findAllByIdInWithLock(uniqueIds).stream()
                .collect(Collectors.toMap(Ticket::getId, Function.identity()));

        // 2. 요청 순서대로 분류
        LocalDateTime canceledAt = LocalDateTime.now(clock);
        List<String> refunded = new ArrayList<>();
        List<String> alreadyCanceled = new ArrayList<>();
        List<String> notFound = new ArrayList<>();

        for (String ticketId : request.ticketIds()) {
            Ticket ticket = ticketsById.get(ticketId);
            if (ticket == null) {
                notFound.add(ticketId);
            } else if (ticket.isCanceled()) {
                alreadyCanceled.add(ticketId);
            } else {
                ticket.cancel(canceledAt, request.reason());
                refunded.add(ticketId);
            }
        }

        metricsCollector.recordRefund(refunded.size(), alreadyCanceled.size(), notFound.size());
        log.info("Refund classified. refunded: {}, alreadyCanceled: {}, notFound: {}",
                refunded.size(), alreadyCanceled.size(), notFound.size());

        // 변경 감지(dirty checking)로 커밋 시 반영
        return new RefundTicketResponse(refunded, alreadyCanceled, notFound);
    }
}
