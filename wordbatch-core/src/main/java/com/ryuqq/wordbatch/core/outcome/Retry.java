package com.ryuqq.wordbatch.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>보강 단계 실패</li>
 *   <li>생성 단계 실패 (연속 실패 임계값 초과 포함)</li>
 *   <li>산출물이 없거나 모두 비어 있음</li>
 * </ul>
 *
 * @param reason 재시도 사유
 * @param attemptCount 현재까지 시도 횟수 (1 이상)
 * @param nextRetryAfterMillis 다음 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record Retry(
    String reason,
    int attemptCount,
    long nextRetryAfterMillis
) implements Outcome {

    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
