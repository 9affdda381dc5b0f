package com.ryuqq.wordbatch.core.protection;

import java.time.Duration;

/**
 * Exponential Backoff 계산기.
 *
 * <p>외부 호출 재시도 간격을 지수적으로 늘리되 [minDelay, maxDelay] 범위로 자릅니다.
 * jitterFactor가 0보다 크면 무작위 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = multiplier * 2^(attemptCount-1)
 * delay = clamp(exponential + jitter, minDelay, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (사전 조회: multiplier=1s, min=1s, max=10s):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 1s</li>
 *   <li>attemptCount=2: 2s</li>
 *   <li>attemptCount=4: 8s</li>
 *   <li>attemptCount=5: 10s (maxDelay)</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long multiplierMs;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: multiplier=1000ms, minDelay=1000ms, maxDelay=10000ms, jitterFactor=0.0</p>
     */
    public BackoffCalculator() {
        this(1000, 1000, 10000, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param multiplierMs 첫 시도의 지수 기준값 (밀리초, 양수)
     * @param minDelayMs 최소 지연 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 (밀리초, minDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long multiplierMs, long minDelayMs, long maxDelayMs, double jitterFactor) {
        if (multiplierMs <= 0) {
            throw new IllegalArgumentException(
                "multiplierMs must be positive (current: " + multiplierMs + ")"
            );
        }
        if (minDelayMs < 0) {
            throw new IllegalArgumentException(
                "minDelayMs must be non-negative (current: " + minDelayMs + ")"
            );
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= minDelayMs (min: " + minDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.multiplierMs = multiplierMs;
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 방금 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public Duration calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // shift 상한 30으로 overflow 방지
        int shift = Math.min(attemptCount - 1, 30);
        long exponential = Math.min(multiplierMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * Math.random());

        long delay = Math.max(minDelayMs, Math.min(exponential + jitter, maxDelayMs));
        return Duration.ofMillis(delay);
    }

    public long getMultiplierMs() {
        return multiplierMs;
    }

    public long getMinDelayMs() {
        return minDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
