package io.hhplus.ticketing.application.usecase.ticket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketResponse;
import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;
import io.hhplus.ticketing.domain.idempotency.IdempotencyCache;
import io.hhplus.ticketing.domain.idempotency.IdempotencyCheckResult;
import io.hhplus.ticketing.infrastructure.metrics.TicketMetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 발권 멱등성 키 관리 서비스
 * <p>
 * 캐시에는 응답을 JSON 문자열로 저장하고, 재전송 시 새 객체로 역직렬화한다.
 * (캐시와 UseCase가 같은 객체를 공유하지 않도록)
 * <p>
 * 분기:
 * - NO_KEY: 발권 진행
 * - REPLAY + 응답 있음: 캐시된 응답 반환
 * - REPLAY + 응답 없음: 첫 요청 처리 중 → 409
 * - CONFLICT: 같은 키, 다른 본문 → 409
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketIdempotencyService {

    private final IdempotencyCache idempotencyCache;
    private final ObjectMapper objectMapper;
    private final TicketMetricsCollector metricsCollector;

    /**
     * 멱등성 키 확인 결과
     *
     * @param reservationId  새 요청일 때 발급된 예약 ID (complete / fail 호출 시 그대로 전달)
     * @param cachedResponse 재전송할 응답 (새 요청이면 null)
     */
    public record Reservation(String reservationId, IssueTicketResponse cachedResponse) {

        public boolean isReplay() {
            return cachedResponse != null;
        }
    }

    /**
     * 멱등성 키 확인 및 예약
     */
    public Reservation reserve(String idempotencyKey, IssueTicketRequest request) {
        IdempotencyCheckResult result = idempotencyCache.checkAndReserve(idempotencyKey, request);

        return switch (result.outcome()) {
            case NO_KEY -> new Reservation(result.reservationId(), null);
            case CONFLICT -> {
                log.warn("Idempotency key reused with a different body. idempotencyKey: {}", idempotencyKey);
                metricsCollector.recordConflict();
                throw new BusinessException(
                    ErrorCode.IDEMPOTENCY_CONFLICT,
                    "같은 멱등성 키로 다른 요청이 전달되었습니다. 새 키를 사용해주세요. idempotencyKey: " + idempotencyKey
                );
            }
            case REPLAY -> {
                if (result.isInFlight()) {
                    log.warn("Concurrent issue request detected for idempotencyKey: {}", idempotencyKey);
                    metricsCollector.recordInProgress();
                    throw new BusinessException(
                        ErrorCode.IDEMPOTENCY_IN_PROGRESS,
                        "이미 처리 중인 요청입니다. 잠시 후 다시 시도해주세요. idempotencyKey: " + idempotencyKey
                    );
                }
                log.info("Returning cached response for idempotencyKey: {}", idempotencyKey);
                metricsCollector.recordReplay();
                yield new Reservation(null, deserializeResponse(result.cachedResponse()));
            }
        };
    }

    /**
     * 완료 처리 (응답 캐싱)
     */
    public void complete(String idempotencyKey, String reservationId, IssueTicketResponse response) {
        idempotencyCache.attachResponse(idempotencyKey, reservationId, serializeResponse(response));
    }

    /**
     * 실패 처리. 응답을 남기지 않으므로 같은 키로 재시도하면 새로 발권된다.
     */
    public void fail(String idempotencyKey, String reservationId, String errorMessage) {
        log.info("Marking idempotencyKey as failed: {}, reason: {}", idempotencyKey, errorMessage);
        idempotencyCache.markFailed(idempotencyKey, reservationId);
    }

    private String serializeResponse(IssueTicketResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize IssueTicketResponse", e);
            throw new BusinessException(
                ErrorCode.INTERNAL_SERVER_ERROR,
                "응답 직렬화 중 오류가 발생했습니다.",
                e
            );
        }
    }

    private IssueTicketResponse deserializeResponse(String json) {
        try {
            return objectMapper.readValue(json, IssueTicketResponse.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize IssueTicketResponse", e);
            throw new BusinessException(
                ErrorCode.INTERNAL_SERVER_ERROR,
                "응답 역직렬화 중 오류가 발생했습니다.",
                e
            );
        }
    }
}
