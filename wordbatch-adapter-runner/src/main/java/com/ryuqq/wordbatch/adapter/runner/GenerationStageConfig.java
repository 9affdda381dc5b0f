package com.ryuqq.wordbatch.adapter.runner;

/**
 * 생성 단계 설정 (불변 record).
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param failureThreshold 단계를 중단시키는 연속 생성 실패 수 (기본 2)
 * @param saveInterval 주기 저장 간격 (단어 수, 기본 10)
 * @param dryRun 앞 {@value EnrichmentConfig#DRY_RUN_LIMIT}개 단어만 처리
 */
public record GenerationStageConfig(
    int failureThreshold,
    int saveInterval,
    boolean dryRun
) {

    public GenerationStageConfig() {
        this(2, 10, false);
    }

    public GenerationStageConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (saveInterval <= 0) {
            throw new IllegalArgumentException(
                "saveInterval must be positive (current: " + saveInterval + ")"
            );
        }
    }

    public GenerationStageConfig withFailureThreshold(int failureThreshold) {
        return new GenerationStageConfig(failureThreshold, saveInterval, dryRun);
    }

    public GenerationStageConfig withSaveInterval(int saveInterval) {
        return new GenerationStageConfig(failureThreshold, saveInterval, dryRun);
    }

    public GenerationStageConfig withDryRun(boolean dryRun) {
        return new GenerationStageConfig(failureThreshold, saveInterval, dryRun);
    }
}
