package com.ryuqq.wordbatch.adapter.client.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.wordbatch.core.model.DictionaryEntry;

import java.util.List;
import java.util.TreeSet;

/**
 * Free Dictionary API 응답 파서.
 *
 * <p><strong>추출 규칙:</strong></p>
 * <ul>
 *   <li>phonetic: 엔트리 순서대로 보면서 처음 나오는 비어 있지 않은 {@code phonetic},
 *       없으면 그 엔트리의 {@code phonetics[].text} 중 첫 번째 값</li>
 *   <li>품사: 모든 {@code meanings[].partOfSpeech} 의 정렬된 중복 제거 목록</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class DictionaryResponseParser {

    private DictionaryResponseParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param entries 응답 최상위 JSON 배열
     * @return 발음과 품사
     */
    public static DictionaryEntry parse(JsonNode entries) {
        String phonetic = null;
        TreeSet<String> partsOfSpeech = new TreeSet<>();

        for (JsonNode entry : entries) {
            if (phonetic == null) {
                phonetic = findPhonetic(entry);
            }
            for (JsonNode meaning : entry.path("meanings")) {
                String partOfSpeech = meaning.path("partOfSpeech").asText("");
                if (!partOfSpeech.isEmpty()) {
                    partsOfSpeech.add(partOfSpeech);
                }
            }
        }
        return new DictionaryEntry(phonetic, List.copyOf(partsOfSpeech));
    }

    private static String findPhonetic(JsonNode entry) {
        String direct = entry.path("phonetic").asText("");
        if (!direct.isEmpty()) {
            return direct;
        }
        for (JsonNode phonetic : entry.path("phonetics")) {
            String text = phonetic.path("text").asText("");
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }
}
