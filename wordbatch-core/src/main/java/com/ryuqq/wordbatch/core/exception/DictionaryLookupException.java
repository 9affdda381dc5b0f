package com.ryuqq.wordbatch.core.exception;

/**
 * 사전 조회 실패.
 *
 * <p>보강 단계는 이 예외를 "사전 정보 없음"으로 취급하고 계속 진행합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class DictionaryLookupException extends TransientExternalFailureException {

    public DictionaryLookupException(String message) {
        super(message);
    }

    public DictionaryLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
