package com.ryuqq.wordbatch.adapter.runner;

import java.time.Duration;

/**
 * 보강 단계 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workers: 동시 조회 수 (기본 2, 사전 API의 429 응답을 피하는 값)</li>
 *   <li>requestDelay: 조회 후 작업자별 대기 (기본 500ms)</li>
 *   <li>dryRun: 구간의 앞 {@value #DRY_RUN_LIMIT}개 단어만 처리</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param workers 동시 조회 수 (1 이상)
 * @param requestDelay 조회 후 대기 (음수 불가)
 * @param dryRun dry-run 여부
 */
public record EnrichmentConfig(
    int workers,
    Duration requestDelay,
    boolean dryRun
) {

    public static final int DRY_RUN_LIMIT = 10;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workers=2, requestDelay=500ms, dryRun=false</p>
     */
    public EnrichmentConfig() {
        this(2, Duration.ofMillis(500), false);
    }

    public EnrichmentConfig {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive (current: " + workers + ")");
        }
        if (requestDelay == null || requestDelay.isNegative()) {
            throw new IllegalArgumentException("requestDelay must be non-negative (current: " + requestDelay + ")");
        }
    }

    public EnrichmentConfig withWorkers(int workers) {
        return new EnrichmentConfig(workers, requestDelay, dryRun);
    }

    public EnrichmentConfig withRequestDelay(Duration requestDelay) {
        return new EnrichmentConfig(workers, requestDelay, dryRun);
    }

    public EnrichmentConfig withDryRun(boolean dryRun) {
        return new EnrichmentConfig(workers, requestDelay, dryRun);
    }
}
