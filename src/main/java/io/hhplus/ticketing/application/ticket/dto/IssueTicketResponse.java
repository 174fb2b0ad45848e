package io.hhplus.ticketing.application.ticket.dto;

import io.hhplus.ticketing.domain.ticket.Ticket;

import java.util.List;

/**
 * 발권 응답. 멱등성 캐시에 그대로 저장되어 재전송된다.
 */
public record IssueTicketResponse(
    List<String> ticketIds,
    Integer count,
    IssueTicketSummary summary
) {
    public static IssueTicketResponse of(List<Ticket> tickets, IssueTicketRequest request) {
        List<String> ticketIds = tickets.stream()
                .map(Ticket::getId)
                .toList();
        return new IssueTicketResponse(
                ticketIds,
                ticketIds.size(),
                new IssueTicketSummary(request.theaterName(), request.movieTitle(), request.priceKrw())
        );
    }
}
