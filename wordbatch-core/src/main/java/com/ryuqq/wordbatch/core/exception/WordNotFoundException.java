package com.ryuqq.wordbatch.core.exception;

/**
 * 사전에 단어가 없음 (HTTP 404).
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class WordNotFoundException extends DictionaryLookupException {

    private final String word;

    public WordNotFoundException(String word) {
        super("Word not found: " + word);
        this.word = word;
    }

    public String getWord() {
        return word;
    }
}
