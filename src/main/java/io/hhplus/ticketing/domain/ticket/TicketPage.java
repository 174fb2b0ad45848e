package io.hhplus.ticketing.domain.ticket;

import java.util.List;

/**
 * 목록 조회 결과 (현재 페이지 + 필터 조건 전체 건수)
 */
public record TicketPage(
    List<Ticket> tickets,
    long total
) {
}
