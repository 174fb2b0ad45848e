package io.hhplus.ticketing.infrastructure.batch;

import io.hhplus.ticketing.config.IdempotencyProperties;
import io.hhplus.ticketing.domain.idempotency.IdempotencyCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * 멱등성 캐시 만료 항목 주기 정리
 *
 * 캐시 연산마다 만료 정리를 하지만, 요청이 끊긴 동안에도 메모리가 회수되도록 한 번 더 돈다.
 * 주기: ticketing.idempotency.sweep-interval
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyCacheSweepScheduler implements SchedulingConfigurer {

    private final IdempotencyCache idempotencyCache;
    private final IdempotencyProperties idempotencyProperties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.addFixedRateTask(this::sweepExpired, idempotencyProperties.sweepInterval());
    }

    public void sweepExpired() {
        try {
            int evicted = idempotencyCache.evictExpired();
            if (evicted > 0) {
                log.info("Evicted {} expired idempotency entries", evicted);
            }
        } catch (RuntimeException e) {
            log.error("Error during idempotency cache sweep", e);
        }
    }
}
