/**
 * 파티션 실행 포트.
 *
 * <p>구현체는 wordbatch-adapter-runner 모듈의 {@code RetryingPartitionRunner}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.application.runtime;
