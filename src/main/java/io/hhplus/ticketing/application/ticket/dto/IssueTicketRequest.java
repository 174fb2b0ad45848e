package io.hhplus.ticketing.application.ticket.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record IssueTicketRequest(
    @NotBlank(message = "극장명은 필수입니다")
    @Size(max = 100, message = "극장명은 100자 이하여야 합니다")
    String theaterName,

    @NotBlank(message = "사용자 ID는 필수입니다")
    @Size(max = 100, message = "사용자 ID는 100자 이하여야 합니다")
    String userId,

    @NotBlank(message = "영화명은 필수입니다")
    @Size(max = 200, message = "영화명은 200자 이하여야 합니다")
    String movieTitle,

    @NotNull(message = "가격은 필수입니다")
    @Min(value = 1, message = "가격은 1원 이상이어야 합니다")
    @Max(value = 1_000_000, message = "가격은 1,000,000원 이하여야 합니다")
    Integer priceKrw,

    @Min(value = 1, message = "수량은 1개 이상이어야 합니다")
    @Max(value = 10, message = "수량은 10개 이하여야 합니다")
    Integer quantity,

    String memo
) {
    public static final int DEFAULT_QUANTITY = 1;

    /**
     * 수량 생략 시 1장. 지문 계산 전에 기본값이 채워지므로
     * quantity 생략 요청과 quantity=1 요청은 같은 요청으로 취급된다.
     */
    public IssueTicketRequest {
        if (quantity == null) {
            quantity = DEFAULT_QUANTITY;
        }
    }
}
