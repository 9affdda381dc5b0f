package com.ryuqq.wordbatch.core.outcome;

import java.util.List;

/**
 * 시도 성공.
 *
 * @param attempt 성공한 시도 번호 (1 이상, 건너뛴 경우 0)
 * @param artifacts 파티션 폴더로 옮겨진 산출물 파일 이름 (건너뛴 경우 빈 목록)
 * @param message 요약 메시지
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record Ok(
    int attempt,
    List<String> artifacts,
    String message
) implements Outcome {

    public Ok {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    /**
     * 처리 없이 성공으로 간주하는 경우 (빈 구간, 기존 산출물 유효).
     *
     * @param message 건너뛴 사유
     * @return attempt=0 인 Ok
     */
    public static Ok skipped(String message) {
        return new Ok(0, List.of(), message);
    }

    public boolean wasSkipped() {
        return attempt == 0;
    }
}
