package com.ryuqq.wordbatch.cli.commands;

import com.ryuqq.wordbatch.adapter.runner.SchedulerConfig;
import com.ryuqq.wordbatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.wordbatch.application.orchestrator.BatchRunSummary;
import com.ryuqq.wordbatch.application.scheduler.ScheduleSummary;
import com.ryuqq.wordbatch.cli.PipelineFactory;
import com.ryuqq.wordbatch.cli.TimeConverter;
import com.ryuqq.wordbatch.cli.WordBatchCli;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.core.partition.PartitionConfig;
import com.ryuqq.wordbatch.core.schedule.RunSchedule;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 시간 bucket마다 배치 묶음 실행.
 *
 * <p>설정 검증은 어휘 로드나 대기보다 먼저 수행됩니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@Command(
    name = "schedule",
    description = "Run groups of batches at fixed wall-clock intervals",
    mixinStandardHelpOptions = true
)
public class ScheduleCommand implements Callable<Integer> {

    @ParentCommand
    private WordBatchCli parent;

    @Option(names = {"--start-time"}, required = true, converter = TimeConverter.class,
        description = "Start time in 'YYYY-MM-DD HH:MM' format")
    private LocalDateTime startTime;

    @Option(names = {"--end-time"}, required = true, converter = TimeConverter.class,
        description = "End time in 'YYYY-MM-DD HH:MM' format")
    private LocalDateTime endTime;

    @Option(names = {"--interval"}, required = true, description = "Interval between runs in hours")
    private double intervalHours;

    @Option(names = {"--start-batch"}, required = true, description = "First batch index to process")
    private int startBatch;

    @Option(names = {"--batch-count"}, required = true, description = "Number of batches to process per run")
    private int batchCount;

    @Option(names = {"--force"}, description = "Reprocess batches that already have valid output")
    private boolean force;

    @Override
    public Integer call() {
        if (!(intervalHours > 0)) {
            throw new ConfigurationException("interval must be positive (current: " + intervalHours + ")");
        }
        Duration interval = RunSchedule.hours(intervalHours);
        SchedulerConfig config = new SchedulerConfig(startTime, endTime, interval, startBatch, batchCount, force);

        PipelineFactory factory = parent.factory();
        BatchOrchestrator orchestrator = new DeferredOrchestrator(
            () -> factory.orchestrator(factory.loadVocabulary(), new PartitionConfig())
        );
        ScheduleSummary summary = factory.scheduler(orchestrator, config).run();
        return summary.exitCode();
    }

    /**
     * 첫 bucket 실행 시점에 어휘를 읽고 오케스트레이터를 만듭니다.
     * 이미 끝난 스케줄은 어휘 파일 없이도 종료됩니다.
     */
    private static final class DeferredOrchestrator implements BatchOrchestrator {

        private final Supplier<BatchOrchestrator> supplier;
        private BatchOrchestrator delegate;

        private DeferredOrchestrator(Supplier<BatchOrchestrator> supplier) {
            this.supplier = supplier;
        }

        @Override
        public BatchRunSummary runFrom(int startBatch, OptionalInt count, boolean force) {
            if (delegate == null) {
                delegate = supplier.get();
            }
            return delegate.runFrom(startBatch, count, force);
        }
    }
}
