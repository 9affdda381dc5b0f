package com.ryuqq.wordbatch.core.exception;

/**
 * 외부 서비스의 일시적 실패 (네트워크, 타임아웃, Rate Limit).
 *
 * <p>제한된 횟수만큼 backoff 후 재시도됩니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class TransientExternalFailureException extends WordBatchException {

    public TransientExternalFailureException(String message) {
        super(message);
    }

    public TransientExternalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
