package com.ryuqq.wordbatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 사전 조회로 발음과 품사 정보가 보강된 단어.
 *
 * <p>사전에서 찾지 못했거나 조회가 실패한 단어는 phonetic=null, partsOfSpeech=[] 로
 * 표현되며, 이후 생성 단계에서는 "unknown" 품사로 처리됩니다.</p>
 *
 * @param word 단어
 * @param phonetic 발음 기호 (null 가능)
 * @param partsOfSpeech 품사 목록 (정렬, 중복 없음)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record EnrichedWord(
    @JsonProperty("word") String word,
    @JsonProperty("phonetic") String phonetic,
    @JsonProperty("pos") List<String> partsOfSpeech
) {

    public EnrichedWord {
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("word cannot be null or blank");
        }
        partsOfSpeech = partsOfSpeech == null ? List.of() : List.copyOf(partsOfSpeech);
    }

    /**
     * 사전 정보 없이 단어만 가진 EnrichedWord 생성.
     *
     * @param word 단어
     * @return phonetic=null, partsOfSpeech=[] 인 EnrichedWord
     */
    public static EnrichedWord bare(String word) {
        return new EnrichedWord(word, null, List.of());
    }

    public boolean hasPhonetic() {
        return phonetic != null && !phonetic.isBlank();
    }

    public boolean hasPartsOfSpeech() {
        return !partsOfSpeech.isEmpty();
    }
}
