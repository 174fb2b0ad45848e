package io.hhplus.ticketing.domain.idempotency;

/**
 * 멱등성 키 상태
 * <p>
 * PROCESSING: 처리 중 (첫 요청이 아직 끝나지 않음)
 * COMPLETED: 완료 (응답 캐싱됨)
 * FAILED: 실패 (동일 요청으로 재시도 가능)
 */
public enum IdempotencyStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
