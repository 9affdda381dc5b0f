package com.ryuqq.wordbatch.core.exception;

/**
 * 체크포인트 저장 실패.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class CheckpointPersistenceException extends WordBatchException {

    public CheckpointPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
