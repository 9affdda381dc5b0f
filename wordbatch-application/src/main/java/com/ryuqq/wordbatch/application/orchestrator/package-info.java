/**
 * 배치 오케스트레이션 포트.
 *
 * <p>구현체는 wordbatch-adapter-runner 모듈의 {@code SequentialBatchOrchestrator}입니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.application.orchestrator;
