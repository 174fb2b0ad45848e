package io.hhplus.ticketing.domain.idempotency;

import java.util.Optional;

/**
 * 멱등성 캐시
 * <p>
 * 재시도된 발권 요청이 티켓을 중복 생성하지 않도록
 * Idempotency-Key → (요청 지문, 응답) 을 보관한다.
 */
public interface IdempotencyCache {

    /**
     * 키를 확인하고, 처음 보는 키라면 현재 요청 지문으로 예약한다.
     * 확인과 예약은 키 단위로 원자적이다.
     */
    IdempotencyCheckResult checkAndReserve(String idempotencyKey, Object requestBody);

    /**
     * 완료된 응답을 저장한다. 지문은 변경하지 않는다.
     * 항목이 만료되었거나 다른 예약으로 바뀌었다면 기록하지 않는다.
     *
     * @param reservationId checkAndReserve(NO_KEY)가 돌려준 예약 ID
     * @return 기록 여부
     */
    boolean attachResponse(String idempotencyKey, String reservationId, String responsePayload);

    /**
     * 실패를 기록한다. 이후 동일 요청은 새 요청으로 처리된다.
     * 예약 ID가 현재 항목과 다르면 기록하지 않는다.
     *
     * @return 기록 여부
     */
    boolean markFailed(String idempotencyKey, String reservationId);

    /**
     * TTL이 지난 항목을 제거하고 제거 건수를 반환한다.
     */
    int evictExpired();

    Optional<IdempotencyEntry> find(String idempotencyKey);

    void clear();
}
