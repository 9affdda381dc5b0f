package com.ryuqq.wordbatch.adapter.client.generation;

import java.util.List;

/**
 * 프롬프트 템플릿 치환.
 *
 * <p>{@code {word}} 는 단어로, {@code {pos}} 는 쉼표로 연결한 품사 목록
 * (없으면 "unknown")으로 바꿉니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class PromptTemplate {

    static final String UNKNOWN_POS = "unknown";

    private PromptTemplate() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String render(String template, String word, List<String> partsOfSpeech) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        String pos = partsOfSpeech == null || partsOfSpeech.isEmpty()
            ? UNKNOWN_POS
            : String.join(", ", partsOfSpeech);
        return template.replace("{word}", word).replace("{pos}", pos);
    }
}
