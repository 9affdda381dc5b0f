package com.ryuqq.wordbatch.adapter.client.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.core.exception.DictionaryLookupException;
import com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException;
import com.ryuqq.wordbatch.core.exception.WordNotFoundException;
import com.ryuqq.wordbatch.core.model.DictionaryEntry;
import com.ryuqq.wordbatch.core.protection.BackoffCalculator;
import com.ryuqq.wordbatch.core.spi.DictionaryClient;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Free Dictionary API 클라이언트.
 *
 * <p><strong>재시도 정책:</strong></p>
 * <ul>
 *   <li>404: 재시도 없이 {@link WordNotFoundException}</li>
 *   <li>타임아웃, 그 밖의 비 2xx 응답 (429, 5xx 등): maxAttempts까지 지수 backoff 재시도</li>
 *   <li>연결 오류, 배열이 아닌 응답: 재시도 없이 {@link DictionaryLookupException}</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class FreeDictionaryClient implements DictionaryClient {

    private static final Logger log = LoggerFactory.getLogger(FreeDictionaryClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DictionaryClientConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public FreeDictionaryClient(HttpClient httpClient, ObjectMapper objectMapper,
                                DictionaryClientConfig config, Sleeper sleeper) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.sleeper = sleeper;
        this.backoff = new BackoffCalculator(
            config.backoffMultiplierMs(), config.minBackoffMs(), config.maxBackoffMs(), 0.0
        );
    }

    @Override
    public DictionaryEntry lookup(String word) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uriFor(word))
            .timeout(config.requestTimeout())
            .header("Accept", "application/json")
            .GET()
            .build();

        for (int attempt = 1; ; attempt++) {
            String retryReason;
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status == 404) {
                    throw new WordNotFoundException(word);
                }
                if (status >= 200 && status < 300) {
                    return parse(word, response.body());
                }
                retryReason = "HTTP " + status;
            } catch (HttpTimeoutException e) {
                retryReason = "timeout";
            } catch (IOException e) {
                throw new DictionaryLookupException("Lookup failed for " + word + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WordBatchInterruptedException("Dictionary lookup interrupted: " + word, e);
            }

            if (attempt >= config.maxAttempts()) {
                throw new DictionaryLookupException(
                    "Lookup failed for " + word + " after " + attempt + " attempts (" + retryReason + ")"
                );
            }
            Duration delay = backoff.calculate(attempt);
            log.debug("Retrying lookup of '{}' in {}ms ({}, attempt {}/{})",
                word, delay.toMillis(), retryReason, attempt, config.maxAttempts());
            sleeper.sleep(delay);
        }
    }

    private DictionaryEntry parse(String word, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new DictionaryLookupException("Unparseable response for: " + word, e);
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new DictionaryLookupException("Unexpected response format for: " + word);
        }
        return DictionaryResponseParser.parse(root);
    }

    URI uriFor(String word) {
        String encoded = URLEncoder.encode(word, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(config.baseUrl() + "/" + encoded);
    }
}
