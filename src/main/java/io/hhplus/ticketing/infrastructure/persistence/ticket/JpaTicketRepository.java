package io.hhplus.ticketing.infrastructure.persistence.ticket;

import io.hhplus.ticketing.domain.ticket.Ticket;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * 티켓 JPA Repository
 */
public interface JpaTicketRepository extends JpaRepository<Ticket, String> {

    /**
     * ID 목록으로 일괄 조회 (Pessimistic Lock)
     * - 단일 IN 쿼리 (N+1 방지)
     * - 같은 티켓을 동시에 환불하는 트랜잭션을 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Ticket t WHERE t.id IN :ids")
    List<Ticket> findAllByIdInWithLock(@Param("ids") Collection<String> ids);
}
