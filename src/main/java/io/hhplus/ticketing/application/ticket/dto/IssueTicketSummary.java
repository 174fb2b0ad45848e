package io.hhplus.ticketing.application.ticket.dto;

public record IssueTicketSummary(
    String theaterName,
    String movieTitle,
    Integer priceKrw
) {
}
