package com.ryuqq.wordbatch.adapter.runner;

import com.ryuqq.wordbatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.wordbatch.application.orchestrator.BatchRunSummary;
import com.ryuqq.wordbatch.application.runtime.PartitionRunner;
import com.ryuqq.wordbatch.core.model.Partition;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import com.ryuqq.wordbatch.core.partition.PartitionCalculator;
import com.ryuqq.wordbatch.core.partition.PartitionConfig;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * 배치를 순서대로 하나씩 처리하는 BatchOrchestrator 구현체.
 *
 * <p>첫 실패 배치에서 멈추고, 그 배치부터 다시 시작하는 명령을 요약에 담습니다.
 * 배치 사이에는 {@link RetryConfig#batchPause()}만큼 대기합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class SequentialBatchOrchestrator implements BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SequentialBatchOrchestrator.class);

    static final String RESUME_COMMAND_PREFIX = "wordbatch batch ";

    private static final String BANNER = "=".repeat(60);

    private final List<VocabularyItem> vocabulary;
    private final PartitionCalculator calculator;
    private final PartitionRunner runner;
    private final RetryConfig config;
    private final Sleeper sleeper;

    public SequentialBatchOrchestrator(List<VocabularyItem> vocabulary, PartitionCalculator calculator,
                                       PartitionRunner runner, RetryConfig config, Sleeper sleeper) {
        if (vocabulary == null) {
            throw new IllegalArgumentException("vocabulary cannot be null");
        }
        if (calculator == null) {
            throw new IllegalArgumentException("calculator cannot be null");
        }
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.vocabulary = List.copyOf(vocabulary);
        this.calculator = calculator;
        this.runner = runner;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public BatchRunSummary runFrom(int startBatch, OptionalInt count, boolean force) {
        if (startBatch < 0) {
            throw new IllegalArgumentException("startBatch must be non-negative (current: " + startBatch + ")");
        }
        if (count.isPresent() && count.getAsInt() <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count.getAsInt() + ")");
        }

        int totalBatches = calculator.totalBatches(vocabulary.size());
        int endBatch = count.isPresent()
            ? (int) Math.min(totalBatches, (long) startBatch + count.getAsInt())
            : totalBatches;

        log.info(BANNER);
        log.info("Batch processing ({} mode)", calculator.getConfig().mode());
        log.info("Batch size: {}", calculator.getConfig().batchSize());
        log.info("Total batches: {}", totalBatches);
        log.info("Total words loaded: {}", vocabulary.size());
        log.info("Running batches {} to {}", startBatch, endBatch - 1);
        if (force) {
            log.info("Force mode: will reprocess all batches");
        }
        log.info(BANNER);

        int processed = 0;
        int skipped = 0;
        List<Integer> failed = new ArrayList<>();

        for (int index = startBatch; index < endBatch; index++) {
            Partition partition = calculator.batchInfo(index, vocabulary.size());
            if (calculator.itemCount(partition, vocabulary) == 0) {
                skipped++;
                continue;
            }

            if (!runner.runPartition(partition, force)) {
                failed.add(index);
                log.error(BANNER);
                log.error("STOPPING: Batch {} ({}) failed to produce valid output", index, partition.label());
                log.error("This likely indicates a systemic issue (rate limiting, API errors, etc.)");
                log.error("To resume from this batch, run: {}", resumeCommand(index));
                log.error(BANNER);
                break;
            }
            processed++;

            if (index + 1 < endBatch) {
                log.info("Waiting {} seconds before next batch...", config.batchPause().toSeconds());
                sleeper.sleep(config.batchPause());
            }
        }

        log.info(BANNER);
        log.info(failed.isEmpty() ? "BATCH PROCESSING COMPLETE" : "BATCH PROCESSING STOPPED (due to failure)");
        log.info(BANNER);
        log.info("Processed: {} batches", processed);
        log.info("Skipped (empty): {} batches", skipped);
        log.info("Failed: {} batches", failed.size());

        String resumeCommand = failed.isEmpty() ? null : resumeCommand(failed.get(0));
        return new BatchRunSummary(processed, skipped, failed, totalBatches, resumeCommand);
    }

    /**
     * 실패한 배치부터 같은 분할로 다시 시작하는 명령.
     *
     * <p>기본값과 다른 분할 설정은 옵션으로 붙여, 같은 인덱스가 같은 파티션을 가리키도록 합니다.</p>
     */
    String resumeCommand(int batchIndex) {
        PartitionConfig partitionConfig = calculator.getConfig();
        PartitionConfig defaults = new PartitionConfig();
        StringBuilder command = new StringBuilder(RESUME_COMMAND_PREFIX).append(batchIndex);
        if (partitionConfig.mode() != defaults.mode()) {
            command.append(" --mode ").append(partitionConfig.mode());
        }
        if (partitionConfig.batchSize() != defaults.batchSize()) {
            command.append(" --batch-size ").append(partitionConfig.batchSize());
        }
        if (partitionConfig.maxFrequency() != defaults.maxFrequency()) {
            command.append(" --max-frequency ").append(partitionConfig.maxFrequency());
        }
        return command.toString();
    }
}
