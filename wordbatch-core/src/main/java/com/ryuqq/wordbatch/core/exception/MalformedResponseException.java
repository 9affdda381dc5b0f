package com.ryuqq.wordbatch.core.exception;

/**
 * 응답은 받았으나 파싱 또는 구조 검증에 실패한 경우.
 *
 * <p>재시도 정책상으로는 일시적 실패와 같게 취급하지만 로그는 별도로 남깁니다.
 * 연속 실패 카운트에는 포함되지 않습니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class MalformedResponseException extends TransientExternalFailureException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
