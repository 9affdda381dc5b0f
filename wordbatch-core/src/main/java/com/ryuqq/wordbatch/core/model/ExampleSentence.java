package com.ryuqq.wordbatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 생성된 예문 한 개.
 *
 * @param sentence 영어 예문
 * @param style 예문 스타일 (Formal, Poetic 등)
 * @param translation 번역문
 * @param translatedWord 번역문 안에서 대상 단어에 대응하는 표현
 * @param displayOrder 노출 순서 (1-4, 선택되지 않은 예문은 null)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record ExampleSentence(
    @JsonProperty("sentence") String sentence,
    @JsonProperty("style") String style,
    @JsonProperty("translation") String translation,
    @JsonProperty("translated_word") String translatedWord,
    @JsonProperty("display_order") Integer displayOrder
) {

    public ExampleSentence {
        sentence = sentence == null ? "" : sentence;
        style = style == null ? "" : style;
        translation = translation == null ? "" : translation;
        translatedWord = translatedWord == null ? "" : translatedWord;
    }
}
