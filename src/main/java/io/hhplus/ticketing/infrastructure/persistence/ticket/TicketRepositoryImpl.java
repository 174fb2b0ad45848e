package io.hhplus.ticketing.infrastructure.persistence.ticket;

import io.hhplus.ticketing.domain.ticket.Ticket;
import io.hhplus.ticketing.domain.ticket.TicketPage;
import io.hhplus.ticketing.domain.ticket.TicketRepository;
import io.hhplus.ticketing.domain.ticket.TicketSearchCondition;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 티켓 Repository 구현체
 * <p>
 * - 단건/일괄 조회, 저장: Spring Data JPA 위임
 * - 목록 조회: 선택 필터가 많아 Criteria API로 동적 쿼리 구성
 *   (offset이 limit의 배수가 아닐 수 있으므로 Pageable 대신 firstResult/maxResults 사용)
 */
@Repository
@Primary
@RequiredArgsConstructor
public class TicketRepositoryImpl implements TicketRepository {

    private final JpaTicketRepository jpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public Ticket save(Ticket ticket) {
        return jpaRepository.save(ticket);
    }

    @Override
    public Optional<Ticket> findById(String id) {
        return jpaRepository.findById(id);
    }

    @Override
    public List<Ticket> findAllByIdInWithLock(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findAllByIdInWithLock(ids);
    }

    @Override
    @Transactional(readOnly = true)
    public TicketPage search(TicketSearchCondition condition, int limit, int offset) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();

        // 1. 페이지 조회 (발권 시각 내림차순, 동일 시각은 ID로 고정 정렬)
        CriteriaQuery<Ticket> query = cb.createQuery(Ticket.class);
        Root<Ticket> root = query.from(Ticket.class);
        query.select(root)
                .where(buildPredicates(cb, root, condition))
                .orderBy(cb.desc(root.get("issuedAt")), cb.desc(root.get("id")));

        List<Ticket> tickets = entityManager.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();

        // 2. 전체 개수
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<Ticket> countRoot = countQuery.from(Ticket.class);
        countQuery.select(cb.count(countRoot))
                .where(buildPredicates(cb, countRoot, condition));
        Long total = entityManager.createQuery(countQuery).getSingleResult();

        return new TicketPage(tickets, total);
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }

    private Predicate[] buildPredicates(CriteriaBuilder cb, Root<Ticket> root, TicketSearchCondition condition) {
        List<Predicate> predicates = new ArrayList<>();
        if (condition.theaterName() != null) {
            predicates.add(cb.equal(root.get("theaterName"), condition.theaterName()));
        }
        if (condition.userId() != null) {
            predicates.add(cb.equal(root.get("userId"), condition.userId()));
        }
        if (condition.movieTitle() != null) {
            predicates.add(cb.equal(root.get("movieTitle"), condition.movieTitle()));
        }
        if (condition.status() != null) {
            predicates.add(cb.equal(root.get("status"), condition.status()));
        }
        return predicates.toArray(new Predicate[0]);
    }
}
