package com.ryuqq.wordbatch.adapter.client.dictionary;

import java.time.Duration;

/**
 * 사전 API 클라이언트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: 조회 URL 접두사 (기본 https://api.dictionaryapi.dev/api/v2/entries/en)</li>
 *   <li>requestTimeout: 요청 하나의 타임아웃 (기본 10초)</li>
 *   <li>maxAttempts: 타임아웃, 429, 5xx 에 대한 총 시도 횟수 (기본 5)</li>
 *   <li>backoffMultiplierMs / minBackoffMs / maxBackoffMs: 지수 backoff (기본 1s, 1s, 10s)</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param baseUrl 조회 URL 접두사
 * @param requestTimeout 요청 타임아웃
 * @param maxAttempts 총 시도 횟수 (1 이상)
 * @param backoffMultiplierMs backoff 기준값 (밀리초)
 * @param minBackoffMs 최소 backoff (밀리초)
 * @param maxBackoffMs 최대 backoff (밀리초)
 */
public record DictionaryClientConfig(
    String baseUrl,
    Duration requestTimeout,
    int maxAttempts,
    long backoffMultiplierMs,
    long minBackoffMs,
    long maxBackoffMs
) {

    public static final String DEFAULT_BASE_URL = "https://api.dictionaryapi.dev/api/v2/entries/en";

    /**
     * 기본 설정 생성자.
     */
    public DictionaryClientConfig() {
        this(DEFAULT_BASE_URL, Duration.ofSeconds(10), 5, 1000, 1000, 10000);
    }

    public DictionaryClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public DictionaryClientConfig withBaseUrl(String baseUrl) {
        return new DictionaryClientConfig(baseUrl, requestTimeout, maxAttempts, backoffMultiplierMs, minBackoffMs, maxBackoffMs);
    }

    public DictionaryClientConfig withMaxAttempts(int maxAttempts) {
        return new DictionaryClientConfig(baseUrl, requestTimeout, maxAttempts, backoffMultiplierMs, minBackoffMs, maxBackoffMs);
    }

    public DictionaryClientConfig withRequestTimeout(Duration requestTimeout) {
        return new DictionaryClientConfig(baseUrl, requestTimeout, maxAttempts, backoffMultiplierMs, minBackoffMs, maxBackoffMs);
    }
}
