package com.ryuqq.wordbatch.adapter.runner.stage;

import com.ryuqq.wordbatch.core.model.ExampleSentence;
import com.ryuqq.wordbatch.core.model.FinalEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * 생성된 항목의 품질 검사.
 *
 * <p>결과는 경고로만 사용되며 항목을 거부하지 않습니다.</p>
 *
 * <ul>
 *   <li>예문 수가 스타일 수(9)와 다름</li>
 *   <li>translatedWord가 translation 안에 없음</li>
 *   <li>sentence 또는 translation에 em dash 포함</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class EntryValidator {

    public static final List<String> EXAMPLE_STYLES = List.of(
        "Formal",
        "Definitional",
        "Contrastive",
        "Collocational",
        "Philosophical",
        "Warm",
        "Poetic",
        "Inspirational",
        "News-like"
    );

    private static final String EM_DASH = "—";

    private EntryValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param entry 검사할 항목
     * @return 경고 메시지 (문제가 없으면 빈 목록)
     */
    public static List<String> validate(FinalEntry entry) {
        List<String> problems = new ArrayList<>();
        List<ExampleSentence> examples = entry.examples();

        if (examples.size() != EXAMPLE_STYLES.size()) {
            problems.add("Expected " + EXAMPLE_STYLES.size() + " examples, got " + examples.size());
        }

        for (int i = 0; i < examples.size(); i++) {
            ExampleSentence example = examples.get(i);
            String translatedWord = example.translatedWord();
            if (!translatedWord.isEmpty() && !example.translation().contains(translatedWord)) {
                problems.add("Example " + (i + 1) + ": translated_word '" + translatedWord + "' not in translation");
            }
            if (example.sentence().contains(EM_DASH) || example.translation().contains(EM_DASH)) {
                problems.add("Example " + (i + 1) + ": contains em dash");
            }
        }
        return problems;
    }
}
