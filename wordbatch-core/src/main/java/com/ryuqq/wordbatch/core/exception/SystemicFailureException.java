package com.ryuqq.wordbatch.core.exception;

/**
 * 연속 실패 임계값 초과.
 *
 * <p>현재 단계 호출을 중단하며, 마지막 주기 저장 이후 누적된 결과는 저장되지 않습니다.
 * 배치 실패로 전파됩니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class SystemicFailureException extends WordBatchException {

    private final int consecutiveFailures;

    public SystemicFailureException(String message, int consecutiveFailures) {
        super(message);
        this.consecutiveFailures = consecutiveFailures;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
