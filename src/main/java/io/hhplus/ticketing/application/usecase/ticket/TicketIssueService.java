package io.hhplus.ticketing.application.usecase.ticket;

import io.hhplus.ticketing.application.ticket.dto.IssueTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketResponse;
import io.hhplus.ticketing.domain.ticket.Ticket;
import io.hhplus.ticketing.domain.ticket.TicketRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 발권 트랜잭션 서비스
 *
 * IssueTicketUseCase와 분리하여 트랜잭션 경계를 명확히 한다.
 * - 메서드가 정상 반환하면 quantity장 전부 커밋
 * - 도중 예외가 발생하면 전부 롤백 (부분 발권 없음)
 * - 멱등성 응답 저장은 커밋 이후 UseCase에서 수행
 */
@Service
@RequiredArgsConstructor
public class TicketIssueService {

    private final TicketRepository ticketRepository;
    private final Clock clock;

    @Transactional
    public IssueTicketResponse issue(IssueTicketRequest request) {
        LocalDateTime issuedAt = LocalDateTime.now(clock);

        List<Ticket> tickets = new ArrayList<>(request.quantity());
        for (int i = 0; i < request.quantity(); i++) {
            Ticket ticket = Ticket.issue(
                    request.theaterName(),
                    request.userId(),
                    request.movieTitle(),
                    request.priceKrw(),
                    request.memo(),
                    issuedAt
            );
            tickets.add(ticketRepository.save(ticket));
        }

        return IssueTicketResponse.of(tickets, request);
    }
}
