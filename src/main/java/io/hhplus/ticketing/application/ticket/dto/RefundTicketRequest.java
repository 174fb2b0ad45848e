package io.hhplus.ticketing.application.ticket.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RefundTicketRequest(
    @NotEmpty(message = "환불할 티켓 ID는 최소 1개 이상이어야 합니다")
    List<@NotBlank(message = "티켓 ID는 비어 있을 수 없습니다") String> ticketIds,

    @Size(max = 500, message = "환불 사유는 500자 이하여야 합니다")
    String reason
) {
}
