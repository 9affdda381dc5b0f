/**
 * 파티션 처리 시도 결과 패키지.
 *
 * <p>{@link com.ryuqq.wordbatch.core.outcome.Outcome}은 Ok, Retry, Fail 세 가지 결과만 허용하는
 * sealed interface입니다. 재시도 루프는 Retry를 받으면 대기 후 다음 시도로 넘어가고,
 * 시도 횟수를 소진하면 Fail로 종료합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.core.outcome;
