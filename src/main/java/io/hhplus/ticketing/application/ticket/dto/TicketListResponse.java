package io.hhplus.ticketing.application.ticket.dto;

import java.util.List;

public record TicketListResponse(
    List<TicketResponse> tickets,
    Long total,
    Integer limit,
    Integer offset
) {
}
