package io.hhplus.ticketing.application.ticket.dto;

/**
 * 발권 결과 + 재전송 여부 (201 / 200 구분용)
 */
public record IssueTicketResult(
    IssueTicketResponse response,
    boolean replayed
) {
    public static IssueTicketResult created(IssueTicketResponse response) {
        return new IssueTicketResult(response, false);
    }

    public static IssueTicketResult replayed(IssueTicketResponse response) {
        return new IssueTicketResult(response, true);
    }
}
