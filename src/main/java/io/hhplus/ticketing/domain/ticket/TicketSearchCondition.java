package io.hhplus.ticketing.domain.ticket;

/**
 * 티켓 목록 조회 필터 (모두 선택, 정확히 일치)
 */
public record TicketSearchCondition(
    String theaterName,
    String userId,
    String movieTitle,
    TicketStatus status
) {
    public static TicketSearchCondition empty() {
        return new TicketSearchCondition(null, null, null, null);
    }
}
