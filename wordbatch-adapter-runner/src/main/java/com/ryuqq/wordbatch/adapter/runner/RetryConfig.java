package com.ryuqq.wordbatch.adapter.runner;

import java.time.Duration;

/**
 * 파티션 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 파티션당 최대 시도 횟수 (기본 3)</li>
 *   <li>retryBackoff: 재시도 전 고정 대기 (기본 5초)</li>
 *   <li>batchPause: 배치 사이 대기 (기본 5초, 외부 API rate limit 완화)</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param retryBackoff 재시도 대기 (음수 불가)
 * @param batchPause 배치 사이 대기 (음수 불가)
 */
public record RetryConfig(
    int maxAttempts,
    Duration retryBackoff,
    Duration batchPause
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, retryBackoff=5s, batchPause=5s</p>
     */
    public RetryConfig() {
        this(3, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (retryBackoff == null || retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must be non-negative (current: " + retryBackoff + ")");
        }
        if (batchPause == null || batchPause.isNegative()) {
            throw new IllegalArgumentException("batchPause must be non-negative (current: " + batchPause + ")");
        }
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, retryBackoff, batchPause);
    }

    public RetryConfig withRetryBackoff(Duration retryBackoff) {
        return new RetryConfig(maxAttempts, retryBackoff, batchPause);
    }

    public RetryConfig withBatchPause(Duration batchPause) {
        return new RetryConfig(maxAttempts, retryBackoff, batchPause);
    }
}
