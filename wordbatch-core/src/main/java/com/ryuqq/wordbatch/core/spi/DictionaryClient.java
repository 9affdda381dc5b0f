package com.ryuqq.wordbatch.core.spi;

import com.ryuqq.wordbatch.core.model.DictionaryEntry;

/**
 * 사전 조회 SPI.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface DictionaryClient {

    /**
     * 단어의 발음과 품사 조회.
     *
     * @param word 단어
     * @return 조회 결과
     * @throws com.ryuqq.wordbatch.core.exception.WordNotFoundException 사전에 없는 단어
     * @throws com.ryuqq.wordbatch.core.exception.DictionaryLookupException 그 밖의 조회 실패
     */
    DictionaryEntry lookup(String word);
}
