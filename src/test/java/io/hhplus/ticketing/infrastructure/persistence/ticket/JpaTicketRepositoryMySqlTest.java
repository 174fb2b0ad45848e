package io.hhplus.ticketing.infrastructure.persistence.ticket;

import io.hhplus.ticketing.config.JpaAuditingConfig;
import io.hhplus.ticketing.domain.ticket.Ticket;
import io.hhplus.ticketing.domain.ticket.TicketPage;
import io.hhplus.ticketing.domain.ticket.TicketSearchCondition;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 실제 MySQL에서 비관적 락 IN 조회와 검색 쿼리가 동작하는지 확인한다.
 * Docker가 없는 환경에서는 건너뛴다.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({TicketRepositoryImpl.class, JpaAuditingConfig.class})
@DisplayName("JpaTicketRepository 통합 테스트 (MySQL Testcontainers)")
class JpaTicketRepositoryMySqlTest {

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("ticketing_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");  // 테스트용 스키마 자동 생성
    }

    @Autowired
    private JpaTicketRepository jpaTicketRepository;

    @Autowired
    private TicketRepositoryImpl ticketRepository;

    @Autowired
    private EntityManager entityManager;

    @Test
    @DisplayName("비관적 락 IN 조회 - 요청한 ID 중 존재하는 것만 반환")
    void findAllByIdInWithLock() {
        // given
        LocalDateTime issuedAt = LocalDateTime.of(2025, 3, 1, 10, 0);
        Ticket first = jpaTicketRepository.save(Ticket.issue("CGV 강남", "user-1", "파묘", 15000, "메모", issuedAt));
        Ticket second = jpaTicketRepository.save(Ticket.issue("CGV 강남", "user-1", "파묘", 15000, null, issuedAt));
        entityManager.flush();
        entityManager.clear();

        // when
        List<Ticket> locked = jpaTicketRepository.findAllByIdInWithLock(List.of(first.getId(), second.getId(), "missing"));

        // then
        assertThat(locked).extracting(Ticket::getId).containsExactlyInAnyOrder(first.getId(), second.getId());
    }

    @Test
    @DisplayName("검색 - 사용자 필터 + 페이징")
    void search() {
        // given
        LocalDateTime base = LocalDateTime.of(2025, 3, 1, 10, 0);
        for (int i = 0; i < 3; i++) {
            ticketRepository.save(Ticket.issue("CGV 강남", "user-1", "파묘", 15000, null, base.plusMinutes(i)));
        }
        ticketRepository.save(Ticket.issue("CGV 강남", "user-2", "파묘", 15000, null, base));
        entityManager.flush();

        // when
        TicketPage page = ticketRepository.search(new TicketSearchCondition(null, "user-1", null, null), 2, 0);

        // then
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.tickets()).hasSize(2);
        assertThat(page.tickets().get(0).getIssuedAt()).isEqualTo(base.plusMinutes(2));
    }
}
