package io.hhplus.ticketing.domain.idempotency;

import java.util.Optional;

/**
 * checkAndReserve 결과
 * <p>
 * - NO_KEY: 처음 보는 키(또는 실패 후 재시도). 호출자가 실제 작업을 수행하고,
 *   reservationId로 결과를 기록한다.
 * - REPLAY: 동일 요청. 응답이 있으면 재전송, 없으면 첫 요청이 아직 처리 중이다.
 * - CONFLICT: 같은 키로 다른 본문이 들어옴
 */
public record IdempotencyCheckResult(Outcome outcome, String cachedResponse, String reservationId) {

    public enum Outcome {
        NO_KEY,
        REPLAY,
        CONFLICT
    }

    public static IdempotencyCheckResult noKey(String reservationId) {
        return new IdempotencyCheckResult(Outcome.NO_KEY, null, reservationId);
    }

    public static IdempotencyCheckResult replay(String cachedResponse) {
        return new IdempotencyCheckResult(Outcome.REPLAY, cachedResponse, null);
    }

    public static IdempotencyCheckResult conflict() {
        return new IdempotencyCheckResult(Outcome.CONFLICT, null, null);
    }

    public Optional<String> response() {
        return Optional.ofNullable(cachedResponse);
    }

    /**
     * 동일 요청이지만 아직 응답이 없는 상태 (첫 요청 처리 중)
     */
    public boolean isInFlight() {
        return outcome == Outcome.REPLAY && cachedResponse == null;
    }
}
