package io.hhplus.ticketing.domain.ticket;

import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 티켓 저장소
 */
public interface TicketRepository {

    int DEFAULT_LIMIT = 100;
    int MAX_LIMIT = 1000;

    Ticket save(Ticket ticket);

    Optional<Ticket> findById(String id);

    /**
     * 여러 ID를 한 번의 조회로 가져온다 (Pessimistic Lock)
     * - 환불 분류의 기반. N번 개별 조회 금지
     * - 존재하지 않는 ID는 결과에서 빠진다.
     */
    List<Ticket> findAllByIdInWithLock(Collection<String> ids);

    /**
     * 필터 + 페이징 조회 (발권 시각 내림차순)
     */
    TicketPage search(TicketSearchCondition condition, int limit, int offset);

    long count();

    default Ticket findByIdOrThrow(String id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.TICKET_NOT_FOUND,
                "티켓을 찾을 수 없습니다. ticketId: " + id
            ));
    }
}
