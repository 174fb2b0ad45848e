package io.hhplus.ticketing.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 발권/환불 메트릭을 수집하는 컴포넌트
 *
 * 수집 메트릭:
 * - ticket_issue_total: 발권 요청 성공/실패 카운터
 * - tickets_issued_total: 생성된 티켓 수
 * - ticket_issue_duration_seconds: 발권 처리 시간 (P50, P95, P99)
 * - idempotency_outcome_total: 재전송/충돌/처리 중 카운터
 * - ticket_refund_total: 환불 분류 결과별 티켓 수
 */
@Component
public class TicketMetricsCollector {

    private final Counter issueSuccessCounter;
    private final Counter issueFailureCounter;
    private final Counter ticketsIssuedCounter;
    private final Timer issueDurationTimer;

    private final Counter idempotencyReplayCounter;
    private final Counter idempotencyConflictCounter;
    private final Counter idempotencyInProgressCounter;

    private final Counter refundedCounter;
    private final Counter alreadyCanceledCounter;
    private final Counter notFoundCounter;

    public TicketMetricsCollector(MeterRegistry meterRegistry) {
        this.issueSuccessCounter = Counter.builder("ticket_issue_total")
                .tag("status", "success")
                .description("Total number of successful issue requests")
                .register(meterRegistry);

        this.issueFailureCounter = Counter.builder("ticket_issue_total")
                .tag("status", "failure")
                .description("Total number of failed issue requests")
                .register(meterRegistry);

        this.ticketsIssuedCounter = Counter.builder("tickets_issued_total")
                .description("Total number of tickets created")
                .register(meterRegistry);

        this.issueDurationTimer = Timer.builder("ticket_issue_duration_seconds")
                .description("Ticket issue processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.idempotencyReplayCounter = idempotencyCounter(meterRegistry, "replay");
        this.idempotencyConflictCounter = idempotencyCounter(meterRegistry, "conflict");
        this.idempotencyInProgressCounter = idempotencyCounter(meterRegistry, "in_progress");

        this.refundedCounter = refundCounter(meterRegistry, "refunded");
        this.alreadyCanceledCounter = refundCounter(meterRegistry, "already_canceled");
        this.notFoundCounter = refundCounter(meterRegistry, "not_found");
    }

    public void recordIssueSuccess(int ticketCount, long startTimeMillis) {
        issueSuccessCounter.increment();
        ticketsIssuedCounter.increment(ticketCount);
        issueDurationTimer.record(System.currentTimeMillis() - startTimeMillis, TimeUnit.MILLISECONDS);
    }

    public void recordIssueFailure() {
        issueFailureCounter.increment();
    }

    public void recordReplay() {
        idempotencyReplayCounter.increment();
    }

    public void recordConflict() {
        idempotencyConflictCounter.increment();
    }

    public void recordInProgress() {
        idempotencyInProgressCounter.increment();
    }

    public void recordRefund(int refunded, int alreadyCanceled, int notFound) {
        refundedCounter.increment(refunded);
        alreadyCanceledCounter.increment(alreadyCanceled);
        notFoundCounter.increment(notFound);
    }

    private static Counter idempotencyCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("idempotency_outcome_total")
                .tag("outcome", outcome)
                .description("Idempotency-Key outcomes other than a fresh request")
                .register(meterRegistry);
    }

    private static Counter refundCounter(MeterRegistry meterRegistry, String result) {
        return Counter.builder("ticket_refund_total")
                .tag("result", result)
                .description("Refund classification per requested ticket id")
                .register(meterRegistry);
    }
}
