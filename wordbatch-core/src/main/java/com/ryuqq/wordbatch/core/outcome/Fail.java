package com.ryuqq.wordbatch.core.outcome;

/**
 * 영구 실패 (재시도 불가).
 *
 * <p>재시도 횟수를 모두 소진했거나, 체크포인트 손상처럼 재시도해도
 * 달라지지 않는 오류를 나타냅니다.</p>
 *
 * @param errorCode 오류 코드 (예: RETRY-EXHAUSTED, CHECKPOINT-CORRUPT)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
