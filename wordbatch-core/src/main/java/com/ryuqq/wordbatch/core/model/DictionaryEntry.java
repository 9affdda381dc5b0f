package com.ryuqq.wordbatch.core.model;

import java.util.List;

/**
 * 사전 조회 결과.
 *
 * @param phonetic 발음 기호 (null 가능)
 * @param partsOfSpeech 품사 목록
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record DictionaryEntry(
    String phonetic,
    List<String> partsOfSpeech
) {

    public DictionaryEntry {
        partsOfSpeech = partsOfSpeech == null ? List.of() : List.copyOf(partsOfSpeech);
    }

    /**
     * 이 조회 결과로 단어를 보강.
     *
     * @param word 단어
     * @return EnrichedWord
     */
    public EnrichedWord enrich(String word) {
        return new EnrichedWord(word, phonetic, partsOfSpeech);
    }
}
