package com.ryuqq.wordbatch.cli.commands;

import com.ryuqq.wordbatch.application.orchestrator.BatchRunSummary;
import com.ryuqq.wordbatch.cli.PipelineFactory;
import com.ryuqq.wordbatch.cli.WordBatchCli;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.core.model.PartitionMode;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import com.ryuqq.wordbatch.core.partition.PartitionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.Callable;

/**
 * 파티션 단위 배치 처리.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@Command(
    name = "batch",
    description = "Process partitions sequentially, stopping at the first failed batch",
    mixinStandardHelpOptions = true
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @ParentCommand
    private WordBatchCli parent;

    @Parameters(index = "0", arity = "0..1", defaultValue = "0", description = "First batch index (default: ${DEFAULT-VALUE})")
    private int startBatch;

    @Option(names = {"--count"}, description = "Number of batch indices to visit (default: all remaining)")
    private Integer count;

    @Option(names = {"--force"}, description = "Reprocess batches that already have valid output")
    private boolean force;

    @Option(
        names = {"--mode"},
        description = "Partition mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "FREQUENCY"
    )
    private PartitionMode mode;

    @Option(names = {"--batch-size"}, description = "Partition width (default: ${DEFAULT-VALUE})", defaultValue = "100")
    private int batchSize;

    @Option(
        names = {"--max-frequency"},
        description = "Upper bound of the frequency domain (default: ${DEFAULT-VALUE})",
        defaultValue = "20000"
    )
    private int maxFrequency;

    @Override
    public Integer call() {
        if (startBatch < 0) {
            throw new ConfigurationException("start batch must be non-negative (current: " + startBatch + ")");
        }
        if (count != null && count <= 0) {
            throw new ConfigurationException("count must be positive (current: " + count + ")");
        }
        PartitionConfig partitionConfig;
        try {
            partitionConfig = new PartitionConfig(mode, batchSize, maxFrequency);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        PipelineFactory factory = parent.factory();
        List<VocabularyItem> vocabulary = factory.loadVocabulary();
        BatchRunSummary summary = factory.orchestrator(vocabulary, partitionConfig).runFrom(
            startBatch, count == null ? OptionalInt.empty() : OptionalInt.of(count), force
        );
        if (summary.resumeCommand() != null) {
            log.info("Resume with: {}", summary.resumeCommand());
        }
        return summary.exitCode();
    }
}
