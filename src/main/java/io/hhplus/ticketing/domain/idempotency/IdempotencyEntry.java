package io.hhplus.ticketing.domain.idempotency;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 멱등성 캐시 항목 (불변 값 객체)
 * <p>
 * 설계:
 * - fingerprint: 최초 요청 본문의 해시. 한 번 정해지면 바뀌지 않는다.
 * - responsePayload: 발권 응답 JSON. 완료 전에는 null
 * - reservationId: 예약(또는 재예약)마다 새로 발급. 결과 기록 시 이 값이 같아야 반영된다.
 * - 상태 전이: PROCESSING → COMPLETED / FAILED, FAILED → PROCESSING (재시도)
 * - 상태 변경은 항상 새 인스턴스를 반환하며, 캐시는 키 단위로 원자적으로 교체한다.
 * <p>
 * 사용 예시:
 * <pre>
 * // 첫 번째 발권 요청
 * idempotencyKey: "xyz-789"
 * → PROCESSING 저장 → 티켓 생성 → COMPLETED (응답 캐싱)
 *
 * // 두 번째 요청 (같은 키, 같은 본문)
 * → COMPLETED → 캐시된 응답 반환 (티켓 안 만듦!)
 * </pre>
 */
@Getter
@ToString(exclude = "responsePayload")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class IdempotencyEntry {

    private final String idempotencyKey;
    private final String reservationId;
    private final String fingerprint;
    private final IdempotencyStatus status;
    private final String responsePayload;
    private final LocalDateTime createdAt;

    // ===== Factory Method =====

    /**
     * 새로운 멱등성 키 예약 (PROCESSING 상태)
     */
    public static IdempotencyEntry reserve(String idempotencyKey, String fingerprint, LocalDateTime now) {
        return new IdempotencyEntry(idempotencyKey, newReservationId(), fingerprint, IdempotencyStatus.PROCESSING, null, now);
    }

    // ===== Business Logic =====

    /**
     * 완료 처리 (응답 캐싱). 여러 번 호출되면 마지막 응답이 남는다.
     */
    public IdempotencyEntry complete(String responsePayload) {
        return new IdempotencyEntry(idempotencyKey, reservationId, fingerprint, IdempotencyStatus.COMPLETED, responsePayload, createdAt);
    }

    /**
     * 실패 처리. 응답은 저장하지 않는다.
     */
    public IdempotencyEntry fail() {
        return new IdempotencyEntry(idempotencyKey, reservationId, fingerprint, IdempotencyStatus.FAILED, null, createdAt);
    }

    /**
     * 실패한 요청의 재시도 (PROCESSING으로 복귀, 새 예약 ID)
     */
    public IdempotencyEntry reopen() {
        return new IdempotencyEntry(idempotencyKey, newReservationId(), fingerprint, IdempotencyStatus.PROCESSING, null, createdAt);
    }

    /**
     * 결과를 기록하려는 쪽이 지금 이 예약의 소유자인지 확인
     */
    public boolean isReservedBy(String otherReservationId) {
        return reservationId.equals(otherReservationId);
    }

    public boolean matches(String otherFingerprint) {
        return fingerprint.equals(otherFingerprint);
    }

    public boolean isCompleted() {
        return status == IdempotencyStatus.COMPLETED;
    }

    public boolean isProcessing() {
        return status == IdempotencyStatus.PROCESSING;
    }

    public boolean isFailed() {
        return status == IdempotencyStatus.FAILED;
    }

    /**
     * 만료 확인 (생성 시각 + ttl 이 지났는지)
     */
    public boolean isExpired(LocalDateTime now, Duration ttl) {
        return now.isAfter(createdAt.plus(ttl));
    }

    private static String newReservationId() {
        return UUID.randomUUID().toString();
    }
}
