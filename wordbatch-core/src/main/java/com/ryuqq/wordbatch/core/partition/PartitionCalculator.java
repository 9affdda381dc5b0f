package com.ryuqq.wordbatch.core.partition;

import com.ryuqq.wordbatch.core.model.Partition;
import com.ryuqq.wordbatch.core.model.PartitionMode;
import com.ryuqq.wordbatch.core.model.RowRange;
import com.ryuqq.wordbatch.core.model.VocabularyItem;

import java.util.List;
import java.util.Optional;

/**
 * 배치 번호 → 파티션 구간 계산기.
 *
 * <p>부수 효과 없는 계산만 수행합니다.</p>
 *
 * <p><strong>FREQUENCY 모드 (batchSize=100):</strong></p>
 * <pre>
 * batch 0 → [1, 100]   "1-100"
 * batch 1 → [101, 200] "101-200"
 * </pre>
 *
 * <p><strong>ROW 모드 (batchSize=100, total=250):</strong></p>
 * <pre>
 * batch 0 → [0, 100)   "0-100"
 * batch 2 → [200, 250) "200-250"  (전체 개수로 잘림)
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class PartitionCalculator {

    private final PartitionConfig config;

    public PartitionCalculator(PartitionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 배치 번호에 해당하는 파티션 계산.
     *
     * @param batchIndex 0 기반 배치 번호
     * @param totalItems 전체 항목 수 (ROW 모드 clamp용, FREQUENCY 모드에서는 무시)
     * @return Partition
     * @throws IllegalArgumentException batchIndex가 음수인 경우
     */
    public Partition batchInfo(int batchIndex, int totalItems) {
        if (batchIndex < 0) {
            throw new IllegalArgumentException("batchIndex must be non-negative (current: " + batchIndex + ")");
        }
        int size = config.batchSize();
        if (config.mode() == PartitionMode.FREQUENCY) {
            int min = batchIndex * size + 1;
            int max = (batchIndex + 1) * size;
            return new Partition(batchIndex, PartitionMode.FREQUENCY, min, max, min + "-" + max);
        }
        int start = batchIndex * size;
        int end = Math.min(start + size, Math.max(totalItems, start));
        return new Partition(batchIndex, PartitionMode.ROW, start, end, start + "-" + end);
    }

    /**
     * 전체 배치 수 계산.
     *
     * <p>FREQUENCY 모드는 maxFrequency, ROW 모드는 전체 항목 수를 기준으로
     * ceil(total / batchSize)를 반환합니다.</p>
     *
     * @param totalItems 전체 항목 수
     * @return 전체 배치 수
     */
    public int totalBatches(int totalItems) {
        int total = config.mode() == PartitionMode.FREQUENCY ? config.maxFrequency() : totalItems;
        return totalBatches(total, config.batchSize());
    }

    /**
     * ceil(total / batchSize).
     *
     * @param total 전체 항목 수 또는 빈도 상한
     * @param batchSize 배치 크기
     * @return 배치 수
     */
    public static int totalBatches(int total, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (total <= 0) {
            return 0;
        }
        return (total + batchSize - 1) / batchSize;
    }

    /**
     * 파티션에 속하는 항목 수.
     *
     * @param partition 파티션
     * @param items 전체 어휘 목록
     * @return 구간에 속하는 항목 수
     */
    public int itemCount(Partition partition, List<VocabularyItem> items) {
        if (partition.mode() == PartitionMode.ROW) {
            return Math.max(0, partition.rangeEnd() - partition.rangeStart());
        }
        int count = 0;
        for (VocabularyItem item : items) {
            if (partition.contains(item)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 파티션을 보강 단계에 넘길 행 구간으로 변환.
     *
     * @param partition 파티션
     * @param items 전체 어휘 목록
     * @return 행 구간, 처리할 항목이 없으면 empty
     */
    public Optional<RowRange> rowRange(Partition partition, List<VocabularyItem> items) {
        if (partition.mode() == PartitionMode.ROW) {
            if (partition.rangeEnd() <= partition.rangeStart()) {
                return Optional.empty();
            }
            return Optional.of(new RowRange(partition.rangeStart(), partition.rangeEnd()));
        }
        return rowRangeForFrequencyRange(items, partition.rangeStart(), partition.rangeEnd());
    }

    /**
     * 빈도 구간 [minFreq, maxFreq]에 속하는 항목들의 행 구간 계산.
     *
     * <p>결과는 일치하는 행 번호의 최소값부터 최대값+1 까지입니다 (convex hull).
     * 입력이 빈도순으로 정렬되어 있지 않으면 구간 안에 빈도 범위 밖의 행이 포함될 수 있으며,
     * 이는 허용된 동작입니다.</p>
     *
     * @param items 전체 어휘 목록
     * @param minFreq 최소 빈도 (포함)
     * @param maxFreq 최대 빈도 (포함)
     * @return [min, max+1) 행 구간, 일치 항목이 없으면 empty
     */
    public static Optional<RowRange> rowRangeForFrequencyRange(List<VocabularyItem> items, int minFreq, int maxFreq) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (VocabularyItem item : items) {
            if (item.frequency() >= minFreq && item.frequency() <= maxFreq) {
                min = Math.min(min, item.rowIndex());
                max = Math.max(max, item.rowIndex());
            }
        }
        if (min == Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new RowRange(min, max + 1));
    }

    public PartitionConfig getConfig() {
        return config;
    }
}
