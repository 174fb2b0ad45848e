package io.hhplus.ticketing.application.ticket.dto;

import java.util.List;

/**
 * 환불 결과. 요청된 ID(중복 포함)는 세 목록 중 정확히 하나에 들어간다.
 */
public record RefundTicketResponse(
    List<String> refunded,
    List<String> alreadyCanceled,
    List<String> notFound
) {
}
