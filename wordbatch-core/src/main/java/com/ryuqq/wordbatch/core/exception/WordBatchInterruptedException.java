package com.ryuqq.wordbatch.core.exception;

/**
 * 대기 또는 외부 호출 중 인터럽트 발생.
 *
 * <p>던지기 전에 현재 스레드의 인터럽트 플래그를 복원해야 합니다.
 * 이미 저장된 체크포인트는 다음 재개 시 그대로 유효합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class WordBatchInterruptedException extends WordBatchException {

    public WordBatchInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
