package com.ryuqq.wordbatch.core.model;

import java.util.List;

/**
 * 생성 서비스가 단어 하나에 대해 돌려준 결과.
 *
 * @param selectedPartOfSpeech 생성에 사용된 품사
 * @param definition 정의
 * @param examples 예문 목록
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record GenerationResult(
    String selectedPartOfSpeech,
    String definition,
    List<ExampleSentence> examples
) {

    public GenerationResult {
        if (selectedPartOfSpeech == null) {
            throw new IllegalArgumentException("selectedPartOfSpeech cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
