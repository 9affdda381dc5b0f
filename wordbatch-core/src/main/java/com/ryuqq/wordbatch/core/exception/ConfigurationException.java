package com.ryuqq.wordbatch.core.exception;

/**
 * 잘못된 설정 또는 CLI 인자.
 *
 * <p>작업을 시작하기 전에 발생해야 합니다 (예: end-time이 start-time보다 이전).</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class ConfigurationException extends WordBatchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
