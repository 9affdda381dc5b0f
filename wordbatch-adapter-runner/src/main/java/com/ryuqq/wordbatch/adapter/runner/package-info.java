/**
 * 실행 엔진 어댑터.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.wordbatch.adapter.runner.RetryingPartitionRunner}: 파티션 재시도와 산출물 회수</li>
 *   <li>{@link com.ryuqq.wordbatch.adapter.runner.SequentialBatchOrchestrator}: fail-fast 순차 배치 실행</li>
 *   <li>{@link com.ryuqq.wordbatch.adapter.runner.TimeBucketScheduler}: 시간 bucket 스케줄 실행</li>
 *   <li>{@code stage}: 보강 단계, 생성 단계, 항목 검사</li>
 * </ul>
 *
 * <p>모든 대기는 {@link com.ryuqq.wordbatch.core.time.Sleeper}를 거치므로 테스트에서 시간을
 * 흘려보낼 수 있습니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.adapter.runner;
