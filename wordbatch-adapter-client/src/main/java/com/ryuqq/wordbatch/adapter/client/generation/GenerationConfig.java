package com.ryuqq.wordbatch.adapter.client.generation;

import java.time.Duration;
import java.util.List;

/**
 * 생성 클라이언트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>executable: 실행 파일 (기본 "claude")</li>
 *   <li>model: 모델 이름 (기본 "claude-opus-4-5-20251101")</li>
 *   <li>timeout: 호출 하나의 타임아웃 (기본 180초)</li>
 *   <li>maxTimeoutAttempts: 타임아웃에 대한 총 시도 횟수 (기본 3)</li>
 *   <li>backoff: 타임아웃 재시도 간격 (기본 multiplier 2s, min 5s, max 60s)</li>
 * </ul>
 *
 * <p>실행 명령은 {@code <executable> -p <prompt> --model <model> --output-format json} 입니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param executable 실행 파일
 * @param model 모델 이름
 * @param timeout 호출 타임아웃
 * @param maxTimeoutAttempts 타임아웃 총 시도 횟수
 * @param backoffMultiplierMs backoff 기준값
 * @param minBackoffMs 최소 backoff
 * @param maxBackoffMs 최대 backoff
 */
public record GenerationConfig(
    String executable,
    String model,
    Duration timeout,
    int maxTimeoutAttempts,
    long backoffMultiplierMs,
    long minBackoffMs,
    long maxBackoffMs
) {

    public static final String DEFAULT_EXECUTABLE = "claude";
    public static final String DEFAULT_MODEL = "claude-opus-4-5-20251101";

    /**
     * 기본 설정 생성자.
     */
    public GenerationConfig() {
        this(DEFAULT_EXECUTABLE, DEFAULT_MODEL, Duration.ofSeconds(180), 3, 2000, 5000, 60000);
    }

    public GenerationConfig {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("executable cannot be null or blank");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (maxTimeoutAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxTimeoutAttempts must be positive (current: " + maxTimeoutAttempts + ")"
            );
        }
    }

    /**
     * 프롬프트에 대한 실행 명령.
     *
     * @param prompt 완성된 프롬프트
     * @return 명령 인자 목록
     */
    public List<String> command(String prompt) {
        return List.of(executable, "-p", prompt, "--model", model, "--output-format", "json");
    }

    public GenerationConfig withExecutable(String executable) {
        return new GenerationConfig(executable, model, timeout, maxTimeoutAttempts, backoffMultiplierMs, minBackoffMs, maxBackoffMs);
    }

    public GenerationConfig withModel(String model) {
        return new GenerationConfig(executable, model, timeout, maxTimeoutAttempts, backoffMultiplierMs, minBackoffMs, maxBackoffMs);
    }

    public GenerationConfig withTimeout(Duration timeout) {
        return new GenerationConfig(executable, model, timeout, maxTimeoutAttempts, backoffMultiplierMs, minBackoffMs, maxBackoffMs);
    }
}
