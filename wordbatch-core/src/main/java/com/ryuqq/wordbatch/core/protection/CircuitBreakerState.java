package com.ryuqq.wordbatch.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 임계값 도달)
 * OPEN (차단, 단계 중단)
 *   │
 *   ▼ (reset)
 * CLOSED
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 연속 실패 횟수를 추적합니다.
     */
    CLOSED,

    /**
     * 차단 상태. 더 이상 외부 호출을 하지 않고 단계를 중단해야 합니다.
     */
    OPEN
}
