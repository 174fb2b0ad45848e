package io.hhplus.ticketing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 멱등성 캐시 설정
 *
 * @param ttl           멱등성 키 보존 기간 (기본 60분)
 * @param sweepInterval 만료 항목 정리 주기 (기본 5분)
 */
@ConfigurationProperties(prefix = "ticketing.idempotency")
public record IdempotencyProperties(
        @DefaultValue("60m") Duration ttl,
        @DefaultValue("5m") Duration sweepInterval) {
}
