package io.hhplus.ticketing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.ticketing.domain.idempotency.IdempotencyCache;
import io.hhplus.ticketing.infrastructure.idempotency.InMemoryIdempotencyCache;
import io.hhplus.ticketing.infrastructure.idempotency.RequestFingerprinter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 멱등성 캐시 및 시간 소스 설정
 *
 * 캐시는 프로세스 단위로 하나만 생성되어 발권 UseCase에 주입된다.
 * (다중 노드 간 공유는 범위 밖)
 */
@Configuration
public class IdempotencyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RequestFingerprinter requestFingerprinter(ObjectMapper objectMapper) {
        return new RequestFingerprinter(objectMapper);
    }

    @Bean
    public IdempotencyCache idempotencyCache(RequestFingerprinter requestFingerprinter,
                                             IdempotencyProperties properties,
                                             Clock clock) {
        return new InMemoryIdempotencyCache(requestFingerprinter, properties.ttl(), clock);
    }
}
