package com.ryuqq.wordbatch.core.spi;

import com.ryuqq.wordbatch.core.model.GenerationResult;

import java.util.List;

/**
 * 정의/예문 생성 SPI.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface GenerationClient {

    /**
     * 단어 하나에 대한 정의와 예문 생성.
     *
     * @param word 단어
     * @param partsOfSpeech 사전 품사 목록 (빈 목록 가능)
     * @param promptTemplate {word}, {pos} 자리표시자를 가진 프롬프트 템플릿
     * @return 생성 결과
     * @throws com.ryuqq.wordbatch.core.exception.GenerationException 호출 실패 (타임아웃 포함)
     * @throws com.ryuqq.wordbatch.core.exception.MalformedResponseException 응답 파싱/구조 검증 실패
     */
    GenerationResult generate(String word, List<String> partsOfSpeech, String promptTemplate);
}
