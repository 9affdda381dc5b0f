package com.ryuqq.wordbatch.core.exception;

/**
 * 생성 서비스 호출 자체가 실패한 경우 (프로세스 비정상 종료, 실행 불가).
 *
 * <p>연속으로 발생하면 Rate Limit 같은 시스템 문제로 판단하여 단계를 중단합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class GenerationException extends TransientExternalFailureException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
