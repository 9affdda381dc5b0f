package com.ryuqq.wordbatch.core.protection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p>성공이 한 번이라도 끼어들면 카운트가 0으로 돌아가고, 성공 없이
 * threshold번 연속 실패하면 OPEN으로 전이합니다. OPEN에서 자동 복구(HALF_OPEN)는 없으며
 * {@link #reset()}으로만 CLOSED가 됩니다.</p>
 *
 * <p>단일 스레드 루프에서 사용합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final int threshold;
    private int consecutiveFailures;
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;

    /**
     * 생성자.
     *
     * @param threshold OPEN으로 전이하는 연속 실패 횟수 (1 이상)
     * @throws IllegalArgumentException threshold가 양수가 아닌 경우
     */
    public ConsecutiveFailureCircuitBreaker(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive (current: " + threshold + ")");
        }
        this.threshold = threshold;
    }

    @Override
    public boolean tryAcquire(String key) {
        return state == CircuitBreakerState.CLOSED;
    }

    @Override
    public void recordSuccess(String key) {
        consecutiveFailures = 0;
    }

    @Override
    public CircuitBreakerState recordFailure(String key, Throwable throwable) {
        consecutiveFailures++;
        log.warn("Consecutive failures: {}/{} (last: {})", consecutiveFailures, threshold, key);
        if (consecutiveFailures >= threshold && state == CircuitBreakerState.CLOSED) {
            state = CircuitBreakerState.OPEN;
            log.error("Circuit opened after {} consecutive failures", consecutiveFailures);
        }
        return state;
    }

    @Override
    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public CircuitBreakerState getState() {
        return state;
    }

    @Override
    public void reset() {
        consecutiveFailures = 0;
        state = CircuitBreakerState.CLOSED;
    }

    public int getThreshold() {
        return threshold;
    }
}
