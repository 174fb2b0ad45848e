package io.hhplus.ticketing.application.usecase.ticket;

import io.hhplus.ticketing.application.ticket.dto.TicketListResponse;
import io.hhplus.ticketing.application.ticket.dto.TicketResponse;
import io.hhplus.ticketing.application.usecase.UseCase;
import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;
import io.hhplus.ticketing.domain.ticket.TicketPage;
import io.hhplus.ticketing.domain.ticket.TicketRepository;
import io.hhplus.ticketing.domain.ticket.TicketSearchCondition;
import io.hhplus.ticketing.domain.ticket.TicketStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 티켓 목록 조회 UseCase
 * <p>
 * 필터: 극장명, 사용자 ID, 영화명, 상태 (모두 선택)
 * 페이징: limit 1~1000 (기본 100), offset 0 이상 (기본 0)
 * 정렬: 발권 시각 내림차순
 */
@UseCase
@RequiredArgsConstructor
public class GetTicketsUseCase {

    private final TicketRepository ticketRepository;

    @Transactional(readOnly = true)
    public TicketListResponse execute(String theaterName, String userId, String movieTitle,
                                      String status, Integer limit, Integer offset) {
        int appliedLimit = limit != null ? limit : TicketRepository.DEFAULT_LIMIT;
        int appliedOffset = offset != null ? offset : 0;
        validatePaging(appliedLimit, appliedOffset);

        TicketSearchCondition condition = new TicketSearchCondition(
                emptyToNull(theaterName),
                emptyToNull(userId),
                emptyToNull(movieTitle),
                StringUtils.hasText(status) ? TicketStatus.from(status) : null
        );

        TicketPage page = ticketRepository.search(condition, appliedLimit, appliedOffset);
        List<TicketResponse> tickets = page.tickets().stream()
                .map(TicketResponse::from)
                .toList();

        return new TicketListResponse(tickets, page.total(), appliedLimit, appliedOffset);
    }

    private void validatePaging(int limit, int offset) {
        if (limit < 1 || limit > TicketRepository.MAX_LIMIT) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("limit은 1 이상 %d 이하여야 합니다. 요청: %d", TicketRepository.MAX_LIMIT, limit)
            );
        }
        if (offset < 0) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "offset은 0 이상이어야 합니다. 요청: " + offset
            );
        }
    }

    private String emptyToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
