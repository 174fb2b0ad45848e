package io.hhplus.ticketing.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 *
 * - Ticket의 created_at / updated_at 자동 갱신
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
