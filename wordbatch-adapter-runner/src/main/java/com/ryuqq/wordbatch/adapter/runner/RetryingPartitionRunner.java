package com.ryuqq.wordbatch.adapter.runner;

import com.ryuqq.wordbatch.adapter.file.config.PipelinePaths;
import com.ryuqq.wordbatch.adapter.file.enrichment.EnrichedWordRepository;
import com.ryuqq.wordbatch.adapter.file.output.FinalOutputRepository;
import com.ryuqq.wordbatch.application.runtime.PartitionRunner;
import com.ryuqq.wordbatch.application.stage.EnrichmentStage;
import com.ryuqq.wordbatch.application.stage.GenerationStage;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException;
import com.ryuqq.wordbatch.core.model.Partition;
import com.ryuqq.wordbatch.core.model.RowRange;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import com.ryuqq.wordbatch.core.outcome.Fail;
import com.ryuqq.wordbatch.core.outcome.Ok;
import com.ryuqq.wordbatch.core.outcome.Outcome;
import com.ryuqq.wordbatch.core.outcome.Retry;
import com.ryuqq.wordbatch.core.partition.PartitionCalculator;
import com.ryuqq.wordbatch.core.spi.ArtifactInspection;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import com.ryuqq.wordbatch.core.spi.OutputValidator;
import com.ryuqq.wordbatch.core.statemachine.PartitionState;
import com.ryuqq.wordbatch.core.statemachine.StateTransition;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 재시도와 산출물 회수를 담당하는 PartitionRunner 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runPartition(partition, force)
 *   ↓
 * PENDING
 *   ├─ 항목 없음 / 유효한 기존 산출물 (force 아님) → SUCCESS
 *   ↓
 * 이전 진행 기록 정리 (두 단계 체크포인트 reset, enriched_words.json 삭제,
 *                      작업 폴더에 남은 산출물은 data/stale/ 로 이동)
 *   ↓
 * for attempt in 1..maxAttempts:
 *   ATTEMPTING
 *     1. enrichment.run(range, attempt > 1)
 *     2. generation.run(attempt > 1)
 *     3. 작업 폴더 산출물 회수
 *          항목 ≥ 1 → final_data/{label}/ 로 이동
 *          항목 = 0 → 삭제
 *   Outcome 분기:
 *     Ok    → SUCCESS
 *     Retry → RETRY, retryBackoff 대기 후 다음 시도
 *     Fail  → FAILED
 *   ↓
 * 시도 소진 → FAILED
 * </pre>
 *
 * <p>진행 기록 정리는 파티션당 한 번, 첫 시도 전에만 수행됩니다. 두 번째 시도부터는
 * 두 단계를 resume 모드로 실행해 앞선 시도의 진행분을 이어받습니다. 작업 폴더에 남은
 * 산출물은 앞선 파티션의 것이므로 이 파티션의 회수 대상이나 resume 대상이 되지 않도록
 * 첫 시도 전에 치워 둡니다.</p>
 *
 * <p>설정 오류({@link ConfigurationException})는 재시도해도 해결되지 않으므로 즉시 FAILED로
 * 끝냅니다. 인터럽트는 그대로 전파됩니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class RetryingPartitionRunner implements PartitionRunner {

    private static final Logger log = LoggerFactory.getLogger(RetryingPartitionRunner.class);

    private static final String BANNER = "=".repeat(60);

    private final List<VocabularyItem> vocabulary;
    private final PartitionCalculator calculator;
    private final EnrichmentStage enrichment;
    private final GenerationStage generation;
    private final CheckpointStore enrichmentCheckpoint;
    private final CheckpointStore generationCheckpoint;
    private final EnrichedWordRepository enrichedWords;
    private final OutputValidator validator;
    private final PipelinePaths paths;
    private final RetryConfig config;
    private final Sleeper sleeper;

    /**
     * 생성자.
     *
     * @param vocabulary 선택된 어휘 전체
     * @param calculator 파티션 계산기
     * @param enrichment 보강 단계
     * @param generation 생성 단계
     * @param enrichmentCheckpoint 보강 체크포인트 (파티션 시작 시 초기화)
     * @param generationCheckpoint 생성 체크포인트 (파티션 시작 시 초기화)
     * @param enrichedWords 보강 중간 파일 (파티션 시작 시 삭제)
     * @param validator 산출물 검증기
     * @param paths 파일 배치
     * @param config 재시도 설정
     * @param sleeper 대기 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryingPartitionRunner(List<VocabularyItem> vocabulary, PartitionCalculator calculator,
                                   EnrichmentStage enrichment, GenerationStage generation,
                                   CheckpointStore enrichmentCheckpoint, CheckpointStore generationCheckpoint,
                                   EnrichedWordRepository enrichedWords, OutputValidator validator,
                                   PipelinePaths paths, RetryConfig config, Sleeper sleeper) {
        if (vocabulary == null) {
            throw new IllegalArgumentException("vocabulary cannot be null");
        }
        if (calculator == null) {
            throw new IllegalArgumentException("calculator cannot be null");
        }
        if (enrichment == null) {
            throw new IllegalArgumentException("enrichment cannot be null");
        }
        if (generation == null) {
            throw new IllegalArgumentException("generation cannot be null");
        }
        if (enrichmentCheckpoint == null) {
            throw new IllegalArgumentException("enrichmentCheckpoint cannot be null");
        }
        if (generationCheckpoint == null) {
            throw new IllegalArgumentException("generationCheckpoint cannot be null");
        }
        if (enrichedWords == null) {
            throw new IllegalArgumentException("enrichedWords cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (paths == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.vocabulary = List.copyOf(vocabulary);
        this.calculator = calculator;
        this.enrichment = enrichment;
        this.generation = generation;
        this.enrichmentCheckpoint = enrichmentCheckpoint;
        this.generationCheckpoint = generationCheckpoint;
        this.enrichedWords = enrichedWords;
        this.validator = validator;
        this.paths = paths;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public boolean runPartition(Partition partition, boolean force) {
        PartitionState state = PartitionState.PENDING;
        String tag = "[Batch " + partition.index() + "] " + partition.label();

        int itemCount = calculator.itemCount(partition, vocabulary);
        if (itemCount == 0) {
            log.info("{}: No words in range, skipping", tag);
            StateTransition.transition(state, PartitionState.SUCCESS);
            return true;
        }

        Path partitionDir = paths.partitionDir(partition.label());
        if (!force && validator.hasValidOutput(partitionDir, itemCount)) {
            log.info("{}: Already has valid output, skipping", tag);
            StateTransition.transition(state, PartitionState.SUCCESS);
            return true;
        }

        Optional<RowRange> range = calculator.rowRange(partition, vocabulary);
        if (range.isEmpty()) {
            log.info("{}: No words in range, skipping", tag);
            StateTransition.transition(state, PartitionState.SUCCESS);
            return true;
        }

        log.info(BANNER);
        log.info("Processing batch {}: {} ({} words, rows {})",
            partition.index(), partition.label(), itemCount, range.get());
        log.info(BANNER);

        createDirectories(partitionDir);
        clearStaleProgress();

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            state = StateTransition.transition(state, PartitionState.ATTEMPTING);
            log.info("Attempt {}/{}", attempt, config.maxAttempts());

            Outcome outcome = attempt(range.get(), partitionDir, attempt);

            if (outcome instanceof Ok ok) {
                StateTransition.transition(state, PartitionState.SUCCESS);
                log.info("Batch {} completed successfully! ({} artifacts)", partition.label(), ok.artifacts().size());
                return true;
            }
            if (outcome instanceof Fail fail) {
                log.error("{}: {} - {}", tag, fail.errorCode(), fail.message());
                break;
            }

            Retry retry = (Retry) outcome;
            if (attempt < config.maxAttempts()) {
                state = StateTransition.transition(state, PartitionState.RETRY);
                log.warn("{}, retrying in {} seconds...", retry.reason(), config.retryBackoff().toSeconds());
                sleeper.sleep(Duration.ofMillis(retry.nextRetryAfterMillis()));
            } else {
                log.warn("{} (no attempts left)", retry.reason());
            }
        }

        StateTransition.transition(state, PartitionState.FAILED);
        log.error("FAILED: Batch {} failed after {} attempts", partition.label(), config.maxAttempts());
        return false;
    }

    /**
     * 두 단계 실행 후 산출물 회수.
     */
    private Outcome attempt(RowRange range, Path partitionDir, int attempt) {
        boolean resume = attempt > 1;
        long backoffMs = config.retryBackoff().toMillis();

        try {
            enrichment.run(range, resume);
        } catch (WordBatchInterruptedException e) {
            throw e;
        } catch (ConfigurationException e) {
            return Fail.of("CONFIGURATION", describe(e));
        } catch (RuntimeException e) {
            log.warn("Enrichment failed: {}", describe(e));
            return new Retry("Enrichment failed: " + describe(e), attempt, backoffMs);
        }

        try {
            generation.run(resume);
        } catch (WordBatchInterruptedException e) {
            throw e;
        } catch (ConfigurationException e) {
            return Fail.of("CONFIGURATION", describe(e));
        } catch (RuntimeException e) {
            log.warn("Generation failed: {}", describe(e));
            return new Retry("Generation failed: " + describe(e), attempt, backoffMs);
        }

        return salvage(partitionDir, attempt, backoffMs);
    }

    /**
     * 작업 폴더의 산출물을 파티션 폴더로 이동.
     *
     * <p>항목이 하나 이상인 산출물만 이동하고 나머지는 삭제합니다.</p>
     */
    private Outcome salvage(Path partitionDir, int attempt, long backoffMs) {
        List<Path> artifacts = FinalOutputRepository.findArtifacts(paths.dataDir());
        if (artifacts.isEmpty()) {
            return new Retry("No output file found", attempt, backoffMs);
        }

        List<String> moved = new ArrayList<>();
        try {
            for (Path artifact : artifacts) {
                ArtifactInspection inspection = validator.inspect(artifact);
                if (inspection.valid()) {
                    Path destination = partitionDir.resolve(artifact.getFileName());
                    Files.move(artifact, destination, StandardCopyOption.REPLACE_EXISTING);
                    moved.add(destination.toString());
                    log.info("Moved: {} -> {} ({} words)", artifact, destination, inspection.itemCount());
                } else {
                    Files.deleteIfExists(artifact);
                    log.warn("Deleted empty output file: {}", artifact);
                }
            }
        } catch (IOException e) {
            return new Retry("Failed to salvage output: " + e.getMessage(), attempt, backoffMs);
        }

        if (moved.isEmpty()) {
            return new Retry("No valid output produced", attempt, backoffMs);
        }
        return new Ok(attempt, moved, "Salvaged " + moved.size() + " artifacts");
    }

    private void clearStaleProgress() {
        enrichmentCheckpoint.reset();
        generationCheckpoint.reset();
        enrichedWords.delete();
        log.debug("Cleared stage checkpoints and {}", enrichedWords.getLocation());
        quarantineLeftoverArtifacts();
    }

    /**
     * 작업 폴더에 남은 산출물을 data/stale/ 로 이동.
     */
    private void quarantineLeftoverArtifacts() {
        List<Path> leftovers = FinalOutputRepository.findArtifacts(paths.dataDir());
        if (leftovers.isEmpty()) {
            return;
        }
        Path staleDir = paths.staleDir();
        createDirectories(staleDir);
        for (Path leftover : leftovers) {
            Path destination = staleDir.resolve(leftover.getFileName());
            try {
                Files.move(leftover, destination, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to move leftover output " + leftover, e);
            }
            log.warn("Moved leftover output from an earlier batch: {} -> {}", leftover, destination);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + dir, e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
