package com.ryuqq.wordbatch.core.model;

/**
 * 선택된 어휘 목록의 한 행.
 *
 * <p>rowIndex는 선택 목록 안에서의 0 기반 위치이고, frequency는 빈도 순위입니다
 * (값이 작을수록 흔한 단어). 목록은 frequency 오름차순으로 정렬되어 있다고 가정합니다.</p>
 *
 * @param rowIndex 0 기반 행 번호
 * @param frequency 빈도 순위 (1 이상)
 * @param word 단어 (checkpoint key로 사용)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record VocabularyItem(
    int rowIndex,
    int frequency,
    String word
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public VocabularyItem {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("rowIndex must be non-negative (current: " + rowIndex + ")");
        }
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("word cannot be null or blank");
        }
    }
}
