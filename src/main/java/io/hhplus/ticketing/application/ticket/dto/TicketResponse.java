package io.hhplus.ticketing.application.ticket.dto;

import io.hhplus.ticketing.domain.ticket.Ticket;

import java.time.LocalDateTime;

public record TicketResponse(
    String id,
    String theaterName,
    String userId,
    String movieTitle,
    Integer priceKrw,
    String status,
    String memo,
    LocalDateTime issuedAt,
    LocalDateTime canceledAt,
    String cancelReason,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {
    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(
                ticket.getId(),
                ticket.getTheaterName(),
                ticket.getUserId(),
                ticket.getMovieTitle(),
                ticket.getPriceKrw(),
                ticket.getStatus().getValue(),
                ticket.getMemo(),
                ticket.getIssuedAt(),
                ticket.getCanceledAt(),
                ticket.getCancelReason(),
                ticket.getCreatedAt(),
                ticket.getUpdatedAt()
        );
    }
}
