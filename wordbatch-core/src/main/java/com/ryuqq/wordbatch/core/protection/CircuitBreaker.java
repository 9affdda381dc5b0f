package com.ryuqq.wordbatch.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>외부 서비스 호출의 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * Rate Limit 같은 시스템 장애 상황에서 잘못된 결과가 쌓이지 않도록 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!breaker.tryAcquire(word)) {
 *     throw new SystemicFailureException("circuit open", breaker.consecutiveFailures());
 * }
 * try {
 *     GenerationResult result = client.generate(word, pos, template);
 *     breaker.recordSuccess(word);
 * } catch (GenerationException e) {
 *     if (breaker.recordFailure(word, e) == CircuitBreakerState.OPEN) {
 *         // 단계 중단
 *     }
 * }
 * }</pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 허용 여부 확인.
     *
     * @param key 호출 대상 key (로깅용)
     * @return CLOSED면 true, OPEN이면 false
     */
    boolean tryAcquire(String key);

    /**
     * 호출 성공 기록. 연속 실패 횟수를 0으로 되돌립니다.
     *
     * @param key 호출 대상 key
     */
    void recordSuccess(String key);

    /**
     * 시스템 문제로 간주되는 실패 기록.
     *
     * @param key 호출 대상 key
     * @param throwable 발생한 예외
     * @return 기록 후 상태
     */
    CircuitBreakerState recordFailure(String key, Throwable throwable);

    /**
     * 연속 실패 횟수 조회.
     *
     * @return 마지막 성공 이후 연속 실패 횟수
     */
    int consecutiveFailures();

    CircuitBreakerState getState();

    /**
     * CLOSED 상태로 강제 리셋.
     */
    void reset();
}
