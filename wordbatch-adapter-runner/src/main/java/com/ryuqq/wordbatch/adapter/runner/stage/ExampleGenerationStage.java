package com.ryuqq.wordbatch.adapter.runner.stage;

import com.ryuqq.wordbatch.adapter.file.enrichment.EnrichedWordRepository;
import com.ryuqq.wordbatch.adapter.file.output.FinalOutputRepository;
import com.ryuqq.wordbatch.adapter.file.prompt.PromptTemplateLoader;
import com.ryuqq.wordbatch.adapter.runner.EnrichmentConfig;
import com.ryuqq.wordbatch.adapter.runner.GenerationStageConfig;
import com.ryuqq.wordbatch.application.stage.GenerationReport;
import com.ryuqq.wordbatch.application.stage.GenerationStage;
import com.ryuqq.wordbatch.core.exception.GenerationException;
import com.ryuqq.wordbatch.core.exception.MalformedResponseException;
import com.ryuqq.wordbatch.core.exception.SystemicFailureException;
import com.ryuqq.wordbatch.core.model.EnrichedWord;
import com.ryuqq.wordbatch.core.model.FinalEntry;
import com.ryuqq.wordbatch.core.model.GenerationResult;
import com.ryuqq.wordbatch.core.protection.CircuitBreaker;
import com.ryuqq.wordbatch.core.protection.CircuitBreakerState;
import com.ryuqq.wordbatch.core.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import com.ryuqq.wordbatch.core.spi.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 생성 클라이언트 기반 예문 생성 단계.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(resume)
 *   ↓
 * 1. enriched_words.json + 프롬프트 템플릿 로드
 * 2. resume: 최신 산출물에 이어 쓰고 체크포인트에 완료된 단어 제외
 *    fresh: 새 산출물 + 체크포인트 초기화
 * 3. 단어별 generate
 *      성공               → 항목 누적, 연속 실패 초기화
 *      MalformedResponse  → markFailed, 연속 실패 초기화
 *      GenerationException→ markFailed, 연속 실패 증가
 *                             임계값 도달 → SystemicFailureException
 *      10개마다           → 산출물 저장 + 저장된 단어 markProcessed
 * 4. 최종 저장
 * </pre>
 *
 * <p>단어는 자신이 포함된 산출물 저장이 성공한 뒤에만 체크포인트에 완료로 기록됩니다.
 * 따라서 연속 실패로 중단되어 버려진 결과는 재개 시 다시 생성됩니다.</p>
 *
 * <p>체크포인트의 lastIndex에는 이번 실행에서 남은 단어 목록 안의 위치가 기록됩니다.
 * 어휘의 행 번호가 아니므로 재개 후에는 그 실행의 목록을 기준으로 다시 0부터 셉니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class ExampleGenerationStage implements GenerationStage {

    private static final Logger log = LoggerFactory.getLogger(ExampleGenerationStage.class);

    private static final int WARNING_PREVIEW = 5;

    private final GenerationClient generationClient;
    private final CheckpointStore checkpoint;
    private final EnrichedWordRepository enrichedWords;
    private final FinalOutputRepository outputs;
    private final PromptTemplateLoader promptLoader;
    private final GenerationStageConfig config;

    public ExampleGenerationStage(GenerationClient generationClient, CheckpointStore checkpoint,
                                  EnrichedWordRepository enrichedWords, FinalOutputRepository outputs,
                                  PromptTemplateLoader promptLoader, GenerationStageConfig config) {
        if (generationClient == null) {
            throw new IllegalArgumentException("generationClient cannot be null");
        }
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        if (enrichedWords == null) {
            throw new IllegalArgumentException("enrichedWords cannot be null");
        }
        if (outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null");
        }
        if (promptLoader == null) {
            throw new IllegalArgumentException("promptLoader cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.generationClient = generationClient;
        this.checkpoint = checkpoint;
        this.enrichedWords = enrichedWords;
        this.outputs = outputs;
        this.promptLoader = promptLoader;
        this.config = config;
    }

    @Override
    public GenerationReport run(boolean resume) {
        log.info("Generating examples...");

        List<EnrichedWord> enriched = enrichedWords.load();
        log.info("Loaded {} enriched words", enriched.size());
        String template = promptLoader.load();

        Path artifact;
        Map<String, FinalEntry> entries = new LinkedHashMap<>();
        if (resume) {
            artifact = outputs.latestArtifact().orElseGet(outputs::newArtifactPath);
            for (FinalEntry entry : outputs.load(artifact)) {
                entries.put(entry.word(), entry);
            }
        } else {
            checkpoint.reset();
            artifact = outputs.newArtifactPath();
        }

        List<EnrichedWord> candidates = enriched;
        if (config.dryRun() && candidates.size() > EnrichmentConfig.DRY_RUN_LIMIT) {
            candidates = candidates.subList(0, EnrichmentConfig.DRY_RUN_LIMIT);
            log.info("Dry run: processing {} words", candidates.size());
        }
        List<EnrichedWord> pending = new ArrayList<>();
        for (EnrichedWord word : candidates) {
            if (!resume || !checkpoint.isProcessed(word.word())) {
                pending.add(word);
            }
        }

        if (pending.isEmpty()) {
            log.info("No words to process (all already completed)");
            return new GenerationReport(Files.exists(artifact) ? artifact : null, 0, List.of(), entries.size());
        }
        log.info("Processing {} words into {}", pending.size(), artifact.getFileName());
        return generateAll(pending, template, artifact, entries);
    }

    private GenerationReport generateAll(List<EnrichedWord> pending, String template,
                                         Path artifact, Map<String, FinalEntry> entries) {
        CircuitBreaker breaker = new ConsecutiveFailureCircuitBreaker(config.failureThreshold());
        List<PendingKey> unsaved = new ArrayList<>();
        List<String> failedWords = new ArrayList<>();
        Map<String, List<String>> warnings = new LinkedHashMap<>();
        int generated = 0;
        int total = pending.size();

        for (int i = 0; i < total; i++) {
            EnrichedWord word = pending.get(i);
            log.info("[{}/{}] Processing: {}", i + 1, total, word.word());

            try {
                GenerationResult result = generationClient.generate(word.word(), word.partsOfSpeech(), template);
                FinalEntry entry = FinalEntry.of(word, result);
                entries.put(word.word(), entry);
                unsaved.add(new PendingKey(word.word(), i));
                breaker.recordSuccess(word.word());
                generated++;

                List<String> problems = EntryValidator.validate(entry);
                if (!problems.isEmpty()) {
                    warnings.put(word.word(), problems);
                    log.warn("[{}/{}] Validation warning for {}: {}", i + 1, total, word.word(), problems);
                }
            } catch (MalformedResponseException e) {
                checkpoint.markFailed(word.word());
                failedWords.add(word.word());
                breaker.reset();
                log.error("[{}/{}] Malformed response for {}: {}", i + 1, total, word.word(), e.getMessage());
            } catch (GenerationException e) {
                checkpoint.markFailed(word.word());
                failedWords.add(word.word());
                log.error("[{}/{}] Failed: {} - {}", i + 1, total, word.word(), e.getMessage());
                if (breaker.recordFailure(word.word(), e) == CircuitBreakerState.OPEN) {
                    log.error("Stopping early due to consecutive failures. {} results since the last save were NOT saved.",
                        unsaved.size());
                    throw new SystemicFailureException(
                        "Stopping after " + breaker.consecutiveFailures() + " consecutive generation errors",
                        breaker.consecutiveFailures()
                    );
                }
            }

            if ((i + 1) % config.saveInterval() == 0) {
                persist(artifact, entries, unsaved);
                log.info("Checkpoint saved: {} words", entries.size());
            }
        }

        persist(artifact, entries, unsaved);
        log.info("Saved {} entries to: {}", entries.size(), artifact);
        log.info("Successfully processed: {}", checkpoint.processedCount());
        log.info("Failed: {}", checkpoint.failedCount());
        logWarnings(warnings);

        return new GenerationReport(artifact, generated, failedWords, entries.size());
    }

    private void persist(Path artifact, Map<String, FinalEntry> entries, List<PendingKey> unsaved) {
        outputs.save(artifact, entries.values());
        for (PendingKey key : unsaved) {
            checkpoint.markProcessed(key.word(), key.index());
        }
        unsaved.clear();
    }

    private static void logWarnings(Map<String, List<String>> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        log.warn("Validation warnings ({} words):", warnings.size());
        warnings.entrySet().stream()
            .limit(WARNING_PREVIEW)
            .forEach(warning -> log.warn("  {}: {}", warning.getKey(), warning.getValue()));
        if (warnings.size() > WARNING_PREVIEW) {
            log.warn("  ... and {} more", warnings.size() - WARNING_PREVIEW);
        }
    }

    private record PendingKey(String word, int index) {
    }
}
