package com.ryuqq.wordbatch.cli.commands;

import com.ryuqq.wordbatch.adapter.runner.EnrichmentConfig;
import com.ryuqq.wordbatch.adapter.runner.GenerationStageConfig;
import com.ryuqq.wordbatch.application.stage.GenerationReport;
import com.ryuqq.wordbatch.cli.PipelineFactory;
import com.ryuqq.wordbatch.cli.RowRangeConverter;
import com.ryuqq.wordbatch.cli.WordBatchCli;
import com.ryuqq.wordbatch.core.exception.SystemicFailureException;
import com.ryuqq.wordbatch.core.model.RowRange;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * 보강과 생성을 한 번 실행 (재시도 없음).
 *
 * <p>연속 생성 실패로 중단되면 저장된 진행 상황을 안내하고 1을 반환합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@Command(
    name = "run",
    description = "Run enrichment and generation once over a word range",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);
    private static final String BANNER = "=".repeat(60);

    @ParentCommand
    private WordBatchCli parent;

    @Option(
        names = {"--word-range"},
        description = "Row range 'start-end' (0-based, end exclusive). Defaults to the whole vocabulary",
        converter = RowRangeConverter.class
    )
    private RowRange wordRange;

    @Option(names = {"--resume"}, description = "Resume from checkpoint")
    private boolean resume;

    @Option(names = {"--dry-run"}, description = "Process only " + EnrichmentConfig.DRY_RUN_LIMIT + " words for testing")
    private boolean dryRun;

    @Override
    public Integer call() {
        PipelineFactory factory = parent.factory();
        List<VocabularyItem> vocabulary = factory.loadVocabulary();
        RowRange range = wordRange != null ? wordRange : new RowRange(0, vocabulary.size());

        log.info(BANNER);
        log.info("WordBatch pipeline");
        log.info(BANNER);
        log.info("Word range: {}", range);
        if (resume) {
            log.info("Mode: Resume from checkpoint");
        }
        if (dryRun) {
            log.info("Mode: Dry run ({} words)", EnrichmentConfig.DRY_RUN_LIMIT);
        }
        log.info(BANNER);

        try {
            factory.enrichmentStage(vocabulary, new EnrichmentConfig().withDryRun(dryRun)).run(range, resume);
            GenerationReport report = factory.generationStage(new GenerationStageConfig().withDryRun(dryRun)).run(resume);

            log.info(BANNER);
            log.info("Pipeline completed successfully!");
            log.info("Output: {} ({} entries, {} failed)", report.artifact(), report.totalEntries(), report.failed());
            log.info(BANNER);
            return 0;
        } catch (SystemicFailureException e) {
            log.error("Pipeline stopped: {}", e.getMessage());
            log.info("Progress has been saved. Use --resume to continue.");
            return WordBatchCli.EXIT_FAILURE;
        }
    }
}
