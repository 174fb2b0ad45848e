package io.hhplus.ticketing.presentation.api.ticket;

import io.hhplus.ticketing.application.ticket.dto.IssueTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketResponse;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketResult;
import io.hhplus.ticketing.application.ticket.dto.RefundTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.RefundTicketResponse;
import io.hhplus.ticketing.application.ticket.dto.TicketListResponse;
import io.hhplus.ticketing.application.ticket.dto.TicketResponse;
import io.hhplus.ticketing.application.usecase.ticket.GetTicketUseCase;
import io.hhplus.ticketing.application.usecase.ticket.GetTicketsUseCase;
import io.hhplus.ticketing.application.usecase.ticket.IssueTicketUseCase;
import io.hhplus.ticketing.application.usecase.ticket.RefundTicketUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/tickets")
@RequiredArgsConstructor
public class TicketController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final IssueTicketUseCase issueTicketUseCase;
    private final RefundTicketUseCase refundTicketUseCase;
    private final GetTicketUseCase getTicketUseCase;
    private final GetTicketsUseCase getTicketsUseCase;

    /**
     * 티켓 발권 API
     *
     * - 새 발권: 201
     * - 동일 Idempotency-Key 재요청: 200 (캐시된 응답)
     */
    @PostMapping("/issue")
    public ResponseEntity<IssueTicketResponse> issueTickets(
            @Valid @RequestBody IssueTicketRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey
    ) {
        IssueTicketResult result = issueTicketUseCase.execute(request, idempotencyKey);
        HttpStatus status = result.replayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result.response());
    }

    @PostMapping("/refund")
    public ResponseEntity<RefundTicketResponse> refundTickets(@Valid @RequestBody RefundTicketRequest request) {
        return ResponseEntity.ok(refundTicketUseCase.execute(request));
    }

    @GetMapping("/{ticketId}")
    public ResponseEntity<TicketResponse> getTicket(@PathVariable String ticketId) {
        return ResponseEntity.ok(getTicketUseCase.execute(ticketId));
    }

    @GetMapping
    public ResponseEntity<TicketListResponse> getTickets(
            @RequestParam(required = false) String theaterName,
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String movieTitle,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") Integer limit,
            @RequestParam(defaultValue = "0") Integer offset
    ) {
        TicketListResponse response = getTicketsUseCase.execute(theaterName, userId, movieTitle, status, limit, offset);
        return ResponseEntity.ok(response);
    }
}
