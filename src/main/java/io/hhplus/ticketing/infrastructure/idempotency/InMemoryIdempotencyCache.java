package io.hhplus.ticketing.infrastructure.idempotency;

import io.hhplus.ticketing.domain.idempotency.IdempotencyCache;
import io.hhplus.ticketing.domain.idempotency.IdempotencyCheckResult;
import io.hhplus.ticketing.domain.idempotency.IdempotencyEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 프로세스 메모리 기반 멱등성 캐시
 * <p>
 * 동시성 제어:
 * - ConcurrentHashMap.compute()로 "기존 항목 확인 → 신규 예약"을 키 단위 원자 연산으로 처리
 * - 같은 새 키로 동시에 들어온 두 요청 중 하나만 NO_KEY를 받는다.
 * - 항목은 불변 객체이므로 읽는 쪽이 중간 상태를 보지 않는다.
 * - 결과 기록(attachResponse / markFailed)은 예약 ID가 같을 때만 반영된다.
 *   TTL보다 오래 걸린 요청이 같은 키의 새 예약을 덮어쓰지 못한다.
 * <p>
 * 만료:
 * - 모든 캐시 연산 시작 시 evictExpired() 호출
 * - IdempotencyCacheSweepScheduler가 주기적으로 한 번 더 정리
 */
@Slf4j
public class InMemoryIdempotencyCache implements IdempotencyCache {

    private final Map<String, IdempotencyEntry> entries = new ConcurrentHashMap<>();
    private final RequestFingerprinter fingerprinter;
    private final Duration ttl;
    private final Clock clock;

    public InMemoryIdempotencyCache(RequestFingerprinter fingerprinter, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Idempotency ttl must be positive: " + ttl);
        }
        this.fingerprinter = fingerprinter;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public IdempotencyCheckResult checkAndReserve(String idempotencyKey, Object requestBody) {
        evictExpired();

        String fingerprint = fingerprinter.fingerprint(requestBody);
        LocalDateTime now = LocalDateTime.now(clock);
        AtomicReference<IdempotencyCheckResult> result = new AtomicReference<>();

        entries.compute(idempotencyKey, (key, existing) -> {
            // 1. 처음 보는 키 (또는 만료) → 예약
            if (existing == null || existing.isExpired(now, ttl)) {
                IdempotencyEntry reserved = IdempotencyEntry.reserve(key, fingerprint, now);
                result.set(IdempotencyCheckResult.noKey(reserved.getReservationId()));
                return reserved;
            }

            // 2. 같은 키, 다른 본문 → 충돌
            if (!existing.matches(fingerprint)) {
                result.set(IdempotencyCheckResult.conflict());
                return existing;
            }

            // 3. 실패했던 동일 요청 → 재처리 가능
            if (existing.isFailed()) {
                IdempotencyEntry reopened = existing.reopen();
                result.set(IdempotencyCheckResult.noKey(reopened.getReservationId()));
                return reopened;
            }

            // 4. 동일 요청 → 캐시된 응답 (처리 중이면 null)
            result.set(IdempotencyCheckResult.replay(existing.getResponsePayload()));
            return existing;
        });

        return result.get();
    }

    @Override
    public boolean attachResponse(String idempotencyKey, String reservationId, String responsePayload) {
        evictExpired();

        AtomicBoolean applied = new AtomicBoolean(false);
        entries.computeIfPresent(idempotencyKey, (key, existing) -> {
            if (!existing.isReservedBy(reservationId)) {
                return existing;
            }
            applied.set(true);
            return existing.complete(responsePayload);
        });

        if (!applied.get()) {
            log.warn("Dropping response for stale idempotency reservation. idempotencyKey: {}, reservationId: {}",
                    idempotencyKey, reservationId);
        }
        return applied.get();
    }

    @Override
    public boolean markFailed(String idempotencyKey, String reservationId) {
        evictExpired();

        AtomicBoolean applied = new AtomicBoolean(false);
        entries.computeIfPresent(idempotencyKey, (key, existing) -> {
            if (!existing.isReservedBy(reservationId)) {
                return existing;
            }
            applied.set(true);
            return existing.fail();
        });

        if (!applied.get()) {
            log.warn("Ignoring failure for stale idempotency reservation. idempotencyKey: {}, reservationId: {}",
                    idempotencyKey, reservationId);
        }
        return applied.get();
    }

    @Override
    public int evictExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        int evicted = 0;
        for (Map.Entry<String, IdempotencyEntry> entry : entries.entrySet()) {
            IdempotencyEntry value = entry.getValue();
            // 검사 이후 교체된 항목은 지우지 않는다
            if (value.isExpired(now, ttl) && entries.remove(entry.getKey(), value)) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public Optional<IdempotencyEntry> find(String idempotencyKey) {
        evictExpired();
        return Optional.ofNullable(entries.get(idempotencyKey));
    }

    @Override
    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
