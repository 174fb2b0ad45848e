package io.hhplus.ticketing.domain.ticket;

import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * 티켓 상태
 * <p>
 * 전이: ISSUED → CANCELED (역방향, 재취소 없음)
 */
@Getter
@RequiredArgsConstructor
public enum TicketStatus {
    /**
     * 발권됨
     */
    ISSUED("issued"),

    /**
     * 취소(환불)됨
     */
    CANCELED("canceled");

    /**
     * API에 노출되는 값
     */
    private final String value;

    public static TicketStatus from(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new BusinessException(
                        ErrorCode.INVALID_INPUT,
                        String.format("올바르지 않은 상태입니다: %s (issued | canceled)", value)
                ));
    }
}
