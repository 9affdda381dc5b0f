/**
 * 장애 격리(Protection) 패키지.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wordbatch.core.protection.CircuitBreaker} - 연속 실패 시 단계 중단 SPI</li>
 *   <li>{@link com.ryuqq.wordbatch.core.protection.ConsecutiveFailureCircuitBreaker} - 연속 실패 횟수 기반 구현</li>
 *   <li>{@link com.ryuqq.wordbatch.core.protection.BackoffCalculator} - 외부 호출 재시도 간격 계산</li>
 * </ul>
 *
 * <h2>적용 위치</h2>
 * <pre>
 * 사전 조회 (HTTP)    : 429/5xx/타임아웃 → BackoffCalculator(1s..10s), 최대 5회
 * 생성 호출 (CLI)     : 타임아웃 → BackoffCalculator(5s..60s), 최대 3회
 * 생성 단계 (단어 루프) : 호출 실패 2회 연속 → CircuitBreaker OPEN → 단계 중단
 * 파티션 재시도        : 고정 5초 대기, 최대 3회 (backoff 계산기 미사용)
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.core.protection;
