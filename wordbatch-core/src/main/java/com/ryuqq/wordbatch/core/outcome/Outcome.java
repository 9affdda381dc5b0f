package com.ryuqq.wordbatch.core.outcome;

/**
 * 파티션 처리 시도 한 번의 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 유효한 산출물을 확보함</li>
 *   <li>{@link Retry}: 일시적 실패, 남은 시도가 있으면 재시도</li>
 *   <li>{@link Fail}: 더 이상 시도하지 않음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
