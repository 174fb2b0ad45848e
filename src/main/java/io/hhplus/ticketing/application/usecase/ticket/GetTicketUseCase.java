package io.hhplus.ticketing.application.usecase.ticket;

import io.hhplus.ticketing.application.ticket.dto.TicketResponse;
import io.hhplus.ticketing.application.usecase.UseCase;
import io.hhplus.ticketing.domain.ticket.TicketRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

@UseCase
@RequiredArgsConstructor
public class GetTicketUseCase {

    private final TicketRepository ticketRepository;

    @Transactional(readOnly = true)
    public TicketResponse execute(String ticketId) {
        return TicketResponse.from(ticketRepository.findByIdOrThrow(ticketId));
    }
}
