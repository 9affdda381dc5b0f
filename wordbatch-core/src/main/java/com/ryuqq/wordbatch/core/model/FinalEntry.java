package com.ryuqq.wordbatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 최종 산출물의 단어 항목.
 *
 * <p>word를 key로 하며, 같은 word로 다시 기록되면 이전 항목을 덮어씁니다.</p>
 *
 * @param word 단어
 * @param phonetic 발음 기호 (null 가능)
 * @param partsOfSpeech 사전 품사 목록
 * @param selectedPartOfSpeech 생성에 사용된 품사
 * @param definition 정의
 * @param examples 예문 목록
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record FinalEntry(
    @JsonProperty("word") String word,
    @JsonProperty("phonetic") String phonetic,
    @JsonProperty("pos") List<String> partsOfSpeech,
    @JsonProperty("selected_pos") String selectedPartOfSpeech,
    @JsonProperty("definition") String definition,
    @JsonProperty("examples") List<ExampleSentence> examples
) {

    public FinalEntry {
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("word cannot be null or blank");
        }
        partsOfSpeech = partsOfSpeech == null ? List.of() : List.copyOf(partsOfSpeech);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    /**
     * 보강된 단어와 생성 결과를 합쳐 FinalEntry 생성.
     *
     * @param enriched 보강된 단어
     * @param generated 생성 결과
     * @return FinalEntry
     */
    public static FinalEntry of(EnrichedWord enriched, GenerationResult generated) {
        return new FinalEntry(
            enriched.word(),
            enriched.phonetic(),
            enriched.partsOfSpeech(),
            generated.selectedPartOfSpeech(),
            generated.definition(),
            generated.examples()
        );
    }
}
