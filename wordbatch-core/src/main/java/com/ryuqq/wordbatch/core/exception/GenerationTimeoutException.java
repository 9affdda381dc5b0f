package com.ryuqq.wordbatch.core.exception;

/**
 * 생성 서비스 호출 타임아웃.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(String message) {
        super(message);
    }
}
