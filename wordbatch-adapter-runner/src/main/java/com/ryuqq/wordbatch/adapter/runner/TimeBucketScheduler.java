package com.ryuqq.wordbatch.adapter.runner;

import com.ryuqq.wordbatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.wordbatch.application.orchestrator.BatchRunSummary;
import com.ryuqq.wordbatch.application.scheduler.BatchScheduler;
import com.ryuqq.wordbatch.application.scheduler.ScheduleSummary;
import com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException;
import com.ryuqq.wordbatch.core.schedule.RunSchedule;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * 시계 기반 BatchScheduler 구현체.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * run()
 *   ↓
 * now &gt; endTime → nothing-to-do
 *   ↓
 * bucket = currentBucket(now)  (앞선 bucket은 skipped)
 *   ↓
 * while bucket &lt; size:
 *   1. 트리거 시각까지 대기 (이미 지났으면 즉시)
 *   2. orchestrator.runFrom(batchStartFor(bucket), batchesPerBucket, force)
 *        실패 또는 예외 → failed, 계속 진행
 *   3. 실행 중 트리거 시각이 지난 bucket → skipped
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class TimeBucketScheduler implements BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimeBucketScheduler.class);

    private static final DateTimeFormatter MINUTES = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String BANNER = "=".repeat(60);

    private final BatchOrchestrator orchestrator;
    private final SchedulerConfig config;
    private final RunSchedule schedule;
    private final Clock clock;
    private final Sleeper sleeper;

    public TimeBucketScheduler(BatchOrchestrator orchestrator, SchedulerConfig config, Clock clock, Sleeper sleeper) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.orchestrator = orchestrator;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.schedule = RunSchedule.of(config.startTime(), config.endTime(), config.interval());
    }

    @Override
    public ScheduleSummary run() {
        logPlan();

        LocalDateTime now = now();
        if (schedule.isOver(now)) {
            log.warn("All scheduled runs are in the past. Nothing to do.");
            log.info("Current time: {}", now.format(SECONDS));
            log.info("Schedule ended at: {}", config.endTime().format(MINUTES));
            return ScheduleSummary.nothingToDo(schedule.size());
        }

        List<Integer> successful = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        List<Integer> skipped = new ArrayList<>();

        int bucket = schedule.currentBucket(now);
        for (int i = 0; i < bucket; i++) {
            skipped.add(i);
        }
        log.info("Current time: {}", now.format(SECONDS));
        if (bucket > 0) {
            log.info("Starting from run {} (in current time bucket)", bucket + 1);
        }

        while (bucket < schedule.size()) {
            waitFor(bucket);

            LocalDateTime runStart = now();
            int batchStart = config.batchStartFor(bucket);
            log.info("-".repeat(40));
            log.info("Run {}/{} starting at {}", bucket + 1, schedule.size(), runStart.format(SECONDS));
            log.info("Processing batches {} to {}", batchStart, batchStart + config.batchesPerBucket() - 1);

            boolean success = runBucket(batchStart);
            Duration elapsed = Duration.between(runStart, now());
            if (success) {
                log.info("Run {} completed successfully in {}", bucket + 1, formatDuration(elapsed));
                successful.add(bucket);
            } else {
                log.warn("Run {} failed after {}", bucket + 1, formatDuration(elapsed));
                failed.add(bucket);
            }

            bucket++;
            LocalDateTime after = now();
            while (bucket < schedule.size() && !after.isBefore(schedule.runTime(bucket))) {
                log.warn("Skipping run {} (scheduled for {}) - time has passed",
                    bucket + 1, schedule.runTime(bucket).format(MINUTES));
                skipped.add(bucket);
                bucket++;
            }
        }

        log.info(BANNER);
        log.info("SCHEDULED BATCH PROCESSING COMPLETE");
        log.info(BANNER);
        log.info("Successful runs: {}", successful.size());
        log.info("Failed runs: {}", failed.size());
        log.info("Skipped runs: {}", skipped.size());
        log.info("Total scheduled: {}", schedule.size());
        if (!failed.isEmpty()) {
            log.warn("Some runs failed. Check the batch logs for details.");
        }
        return new ScheduleSummary(successful, failed, skipped, schedule.size(), false);
    }

    private boolean runBucket(int batchStart) {
        try {
            BatchRunSummary summary = orchestrator.runFrom(
                batchStart, OptionalInt.of(config.batchesPerBucket()), config.force()
            );
            return summary.isSuccess();
        } catch (WordBatchInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Batch run failed: {}", e.getMessage(), e);
            return false;
        }
    }

    private void waitFor(int bucket) {
        LocalDateTime scheduled = schedule.runTime(bucket);
        LocalDateTime now = now();
        if (now.isBefore(scheduled)) {
            Duration wait = Duration.between(now, scheduled);
            log.info("Waiting {} until run {} at {}", formatDuration(wait), bucket + 1, scheduled.format(MINUTES));
            sleeper.sleep(wait);
        } else {
            log.info("Scheduled time {} has passed, starting immediately", scheduled.format(MINUTES));
        }
    }

    private void logPlan() {
        log.info(BANNER);
        log.info("Scheduled batch processing");
        log.info(BANNER);
        log.info("Schedule: {} to {}", config.startTime().format(MINUTES), config.endTime().format(MINUTES));
        log.info("Interval: {}", formatDuration(config.interval()));
        log.info("Starting batch: {}", config.startBatch());
        log.info("Batches per run: {}", config.batchesPerBucket());
        log.info("Force mode: {}", config.force());
        log.info("Total scheduled runs: {}", schedule.size());
        for (int i = 0; i < schedule.size(); i++) {
            int batchStart = config.batchStartFor(i);
            log.info("  Run {}: {} - Batches {}-{}", i + 1, schedule.runTime(i).format(MINUTES),
                batchStart, batchStart + config.batchesPerBucket() - 1);
        }
        log.info(BANNER);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * 사람이 읽기 쉬운 기간 표기 (초, 분, 시간).
     *
     * @param duration 기간
     * @return 예: "45 seconds", "2.5 minutes", "1.25 hours"
     */
    static String formatDuration(Duration duration) {
        double seconds = duration.toMillis() / 1000d;
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.0f seconds", seconds);
        }
        if (seconds < 3600) {
            return String.format(Locale.ROOT, "%.1f minutes", seconds / 60);
        }
        return String.format(Locale.ROOT, "%.2f hours", seconds / 3600);
    }
}
