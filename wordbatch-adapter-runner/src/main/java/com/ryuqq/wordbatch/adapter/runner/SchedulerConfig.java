package com.ryuqq.wordbatch.adapter.runner;

import com.ryuqq.wordbatch.core.exception.ConfigurationException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 시간 bucket 스케줄 설정 (불변 record).
 *
 * <p>검증 실패는 실행 전에 {@link ConfigurationException}으로 보고됩니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param startTime 첫 bucket 시각
 * @param endTime 이 시각 이후에는 새 bucket을 시작하지 않음 (startTime보다 뒤여야 함)
 * @param interval bucket 간격 (양수)
 * @param startBatch bucket 0 의 첫 배치 번호 (0 이상)
 * @param batchesPerBucket bucket 하나가 실행할 배치 수 (1 이상)
 * @param force 기존 산출물이 있어도 다시 처리
 */
public record SchedulerConfig(
    LocalDateTime startTime,
    LocalDateTime endTime,
    Duration interval,
    int startBatch,
    int batchesPerBucket,
    boolean force
) {

    public SchedulerConfig {
        if (startTime == null || endTime == null) {
            throw new ConfigurationException("start-time and end-time are required");
        }
        if (!endTime.isAfter(startTime)) {
            throw new ConfigurationException("end-time must be after start-time");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("interval must be positive (current: " + interval + ")");
        }
        if (startBatch < 0) {
            throw new ConfigurationException("start-batch must be non-negative (current: " + startBatch + ")");
        }
        if (batchesPerBucket <= 0) {
            throw new ConfigurationException("batch-count must be positive (current: " + batchesPerBucket + ")");
        }
    }

    /**
     * bucket의 첫 배치 번호.
     *
     * @param bucket bucket 번호 (0부터)
     * @return startBatch + bucket * batchesPerBucket
     */
    public int batchStartFor(int bucket) {
        return startBatch + bucket * batchesPerBucket;
    }

    public SchedulerConfig withForce(boolean force) {
        return new SchedulerConfig(startTime, endTime, interval, startBatch, batchesPerBucket, force);
    }
}
