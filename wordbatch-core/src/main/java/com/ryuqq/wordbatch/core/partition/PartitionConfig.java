package com.ryuqq.wordbatch.core.partition;

import com.ryuqq.wordbatch.core.model.PartitionMode;

/**
 * 파티션 분할 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mode: 분할 방식 (기본 FREQUENCY)</li>
 *   <li>batchSize: 배치 하나의 크기 (기본 100, FREQUENCY는 빈도 폭, ROW는 행 수)</li>
 *   <li>maxFrequency: FREQUENCY 모드의 전체 빈도 상한 (기본 20000)</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param mode 분할 방식 (null 불가)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxFrequency 빈도 상한 (1 이상)
 */
public record PartitionConfig(
    PartitionMode mode,
    int batchSize,
    int maxFrequency
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: mode=FREQUENCY, batchSize=100, maxFrequency=20000</p>
     */
    public PartitionConfig() {
        this(PartitionMode.FREQUENCY, 100, 20000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PartitionConfig {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (maxFrequency <= 0) {
            throw new IllegalArgumentException(
                "maxFrequency must be positive (current: " + maxFrequency + ")"
            );
        }
    }

    public PartitionConfig withMode(PartitionMode mode) {
        return new PartitionConfig(mode, batchSize, maxFrequency);
    }

    public PartitionConfig withBatchSize(int batchSize) {
        return new PartitionConfig(mode, batchSize, maxFrequency);
    }

    public PartitionConfig withMaxFrequency(int maxFrequency) {
        return new PartitionConfig(mode, batchSize, maxFrequency);
    }
}
