package com.ryuqq.wordbatch.core.model;

/**
 * 하나의 배치 단위 (파생 값, 저장되지 않음).
 *
 * <p>범위 의미는 mode에 따라 다릅니다:</p>
 * <ul>
 *   <li>FREQUENCY: [rangeStart, rangeEnd] 빈도 구간 (양 끝 포함), label "{min}-{max}"</li>
 *   <li>ROW: [rangeStart, rangeEnd) 행 구간 (끝 제외), label "{start}-{end}"</li>
 * </ul>
 *
 * @param index 0 기반 배치 번호
 * @param mode 분할 방식
 * @param rangeStart 구간 시작
 * @param rangeEnd 구간 끝 (FREQUENCY는 포함, ROW는 제외)
 * @param label 출력 폴더 이름으로 쓰이는 안정적인 구간 식별자
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record Partition(
    int index,
    PartitionMode mode,
    int rangeStart,
    int rangeEnd,
    String label
) {

    public Partition {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
    }

    /**
     * 항목이 이 파티션 구간에 속하는지 확인.
     *
     * @param item 어휘 항목
     * @return 구간 포함 여부
     */
    public boolean contains(VocabularyItem item) {
        if (mode == PartitionMode.FREQUENCY) {
            return item.frequency() >= rangeStart && item.frequency() <= rangeEnd;
        }
        return item.rowIndex() >= rangeStart && item.rowIndex() < rangeEnd;
    }

    @Override
    public String toString() {
        return "Partition{" + index + ":" + label + "}";
    }
}
