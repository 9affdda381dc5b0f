package com.ryuqq.wordbatch.application.stage;

import java.nio.file.Path;
import java.util.List;

/**
 * 생성 단계 실행 결과.
 *
 * @param artifact 기록된 산출물 파일 (처리할 단어가 없어 아무것도 쓰지 않았으면 null)
 * @param generated 이번 실행에서 생성에 성공한 단어 수
 * @param failedWords 이번 실행에서 실패한 단어
 * @param totalEntries 산출물에 들어 있는 전체 항목 수
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record GenerationReport(
    Path artifact,
    int generated,
    List<String> failedWords,
    int totalEntries
) {

    public GenerationReport {
        failedWords = failedWords == null ? List.of() : List.copyOf(failedWords);
    }

    public int failed() {
        return failedWords.size();
    }
}
