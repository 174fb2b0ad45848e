package io.hhplus.ticketing.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 티켓 관련 (T)
    // ====================================
    TICKET_NOT_FOUND("T001", "티켓을 찾을 수 없습니다"),
    INVALID_TICKET_STATUS("T002", "티켓 상태가 올바르지 않습니다"),

    // ====================================
    // 멱등성 관련 (I)
    // ====================================
    IDEMPOTENCY_CONFLICT("I001", "동일한 멱등성 키로 다른 요청이 전달되었습니다"),
    IDEMPOTENCY_IN_PROGRESS("I002", "동일한 멱등성 키의 요청이 처리 중입니다"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다"),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다"),
    STORAGE_FAILURE("COMMON003", "저장소 처리 중 오류가 발생했습니다");

    private final String code;
    private final String message;
}
