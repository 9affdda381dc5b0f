package com.ryuqq.wordbatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.adapter.client.dictionary.DictionaryClientConfig;
import com.ryuqq.wordbatch.adapter.client.dictionary.FreeDictionaryClient;
import com.ryuqq.wordbatch.adapter.client.generation.CommandLineGenerationClient;
import com.ryuqq.wordbatch.adapter.client.generation.GenerationConfig;
import com.ryuqq.wordbatch.adapter.client.generation.GenerationResponseParser;
import com.ryuqq.wordbatch.adapter.client.generation.ProcessCommandExecutor;
import com.ryuqq.wordbatch.adapter.file.checkpoint.FileCheckpointStore;
import com.ryuqq.wordbatch.adapter.file.config.PipelinePaths;
import com.ryuqq.wordbatch.adapter.file.enrichment.EnrichedWordRepository;
import com.ryuqq.wordbatch.adapter.file.json.JsonMappers;
import com.ryuqq.wordbatch.adapter.file.output.FinalOutputRepository;
import com.ryuqq.wordbatch.adapter.file.output.JsonArtifactValidator;
import com.ryuqq.wordbatch.adapter.file.prompt.PromptTemplateLoader;
import com.ryuqq.wordbatch.adapter.file.vocabulary.VocabularyRepository;
import com.ryuqq.wordbatch.adapter.file.vocabulary.VocabularySelector;
import com.ryuqq.wordbatch.adapter.runner.EnrichmentConfig;
import com.ryuqq.wordbatch.adapter.runner.GenerationStageConfig;
import com.ryuqq.wordbatch.adapter.runner.RetryConfig;
import com.ryuqq.wordbatch.adapter.runner.RetryingPartitionRunner;
import com.ryuqq.wordbatch.adapter.runner.SchedulerConfig;
import com.ryuqq.wordbatch.adapter.runner.SequentialBatchOrchestrator;
import com.ryuqq.wordbatch.adapter.runner.TimeBucketScheduler;
import com.ryuqq.wordbatch.adapter.runner.stage.DictionaryEnrichmentStage;
import com.ryuqq.wordbatch.adapter.runner.stage.ExampleGenerationStage;
import com.ryuqq.wordbatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.wordbatch.application.scheduler.BatchScheduler;
import com.ryuqq.wordbatch.application.stage.EnrichmentStage;
import com.ryuqq.wordbatch.application.stage.GenerationStage;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import com.ryuqq.wordbatch.core.partition.PartitionCalculator;
import com.ryuqq.wordbatch.core.partition.PartitionConfig;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import com.ryuqq.wordbatch.core.spi.DictionaryClient;
import com.ryuqq.wordbatch.core.spi.GenerationClient;
import com.ryuqq.wordbatch.core.time.Sleeper;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;

/**
 * CLI 명령이 사용하는 구성 요소 조립.
 *
 * <p>모든 설정은 명시적으로 주입되며 전역 상태를 두지 않습니다.
 * 테스트는 외부 클라이언트와 Clock, Sleeper를 대체한 인스턴스를 사용합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class PipelineFactory {

    private final PipelinePaths paths;
    private final DictionaryClient dictionaryClient;
    private final GenerationClient generationClient;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ObjectMapper mapper;

    public PipelineFactory(PipelinePaths paths, DictionaryClient dictionaryClient,
                           GenerationClient generationClient, Clock clock, Sleeper sleeper) {
        if (paths == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
        if (dictionaryClient == null) {
            throw new IllegalArgumentException("dictionaryClient cannot be null");
        }
        if (generationClient == null) {
            throw new IllegalArgumentException("generationClient cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.paths = paths;
        this.dictionaryClient = dictionaryClient;
        this.generationClient = generationClient;
        this.clock = clock;
        this.sleeper = sleeper;
        this.mapper = JsonMappers.create();
    }

    /**
     * 실제 사전 API와 생성 명령을 사용하는 기본 구성.
     *
     * @param paths 파일 배치
     * @return PipelineFactory
     */
    public static PipelineFactory create(PipelinePaths paths) {
        ObjectMapper mapper = JsonMappers.create();
        Sleeper sleeper = Sleeper.system();
        DictionaryClientConfig dictionaryConfig = new DictionaryClientConfig();
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(dictionaryConfig.requestTimeout())
            .build();
        DictionaryClient dictionary = new FreeDictionaryClient(httpClient, mapper, dictionaryConfig, sleeper);
        GenerationClient generation = new CommandLineGenerationClient(
            new ProcessCommandExecutor(), new GenerationResponseParser(mapper), new GenerationConfig(), sleeper
        );
        return new PipelineFactory(paths, dictionary, generation, Clock.systemDefaultZone(), sleeper);
    }

    public List<VocabularyItem> loadVocabulary() {
        return new VocabularyRepository().load(paths.selectedWordsCsv());
    }

    public List<VocabularyItem> selectVocabulary() {
        return new VocabularySelector().select(paths.wordSelectionCsv(), paths.selectedWordsCsv());
    }

    public EnrichmentStage enrichmentStage(List<VocabularyItem> vocabulary, EnrichmentConfig config) {
        return enrichmentStage(vocabulary, config, enrichmentCheckpoint(), enrichedWords());
    }

    public GenerationStage generationStage(GenerationStageConfig config) {
        return generationStage(config, generationCheckpoint(), enrichedWords());
    }

    /**
     * 배치 오케스트레이터 조립.
     *
     * <p>runner와 각 단계는 같은 체크포인트 store 인스턴스를 공유합니다.
     * runner의 진행 기록 정리가 단계의 캐시에도 반영되어야 하기 때문입니다.</p>
     *
     * @param vocabulary 전체 어휘
     * @param partitionConfig 파티션 설정
     * @return BatchOrchestrator
     */
    public BatchOrchestrator orchestrator(List<VocabularyItem> vocabulary, PartitionConfig partitionConfig) {
        PartitionCalculator calculator = new PartitionCalculator(partitionConfig);
        RetryConfig retryConfig = new RetryConfig();
        CheckpointStore enrichmentCheckpoint = enrichmentCheckpoint();
        CheckpointStore generationCheckpoint = generationCheckpoint();
        EnrichedWordRepository enrichedWords = enrichedWords();

        RetryingPartitionRunner runner = new RetryingPartitionRunner(
            vocabulary, calculator,
            enrichmentStage(vocabulary, new EnrichmentConfig(), enrichmentCheckpoint, enrichedWords),
            generationStage(new GenerationStageConfig(), generationCheckpoint, enrichedWords),
            enrichmentCheckpoint, generationCheckpoint, enrichedWords,
            new JsonArtifactValidator(mapper), paths, retryConfig, sleeper
        );
        return new SequentialBatchOrchestrator(vocabulary, calculator, runner, retryConfig, sleeper);
    }

    public BatchScheduler scheduler(BatchOrchestrator orchestrator, SchedulerConfig config) {
        return new TimeBucketScheduler(orchestrator, config, clock, sleeper);
    }

    public PipelinePaths getPaths() {
        return paths;
    }

    private EnrichmentStage enrichmentStage(List<VocabularyItem> vocabulary, EnrichmentConfig config,
                                            CheckpointStore checkpoint, EnrichedWordRepository enrichedWords) {
        return new DictionaryEnrichmentStage(vocabulary, dictionaryClient, checkpoint, enrichedWords, config, sleeper);
    }

    private GenerationStage generationStage(GenerationStageConfig config, CheckpointStore checkpoint,
                                            EnrichedWordRepository enrichedWords) {
        return new ExampleGenerationStage(
            generationClient, checkpoint, enrichedWords,
            new FinalOutputRepository(paths.dataDir(), mapper, clock),
            new PromptTemplateLoader(paths.promptTemplate()), config
        );
    }

    private CheckpointStore enrichmentCheckpoint() {
        return new FileCheckpointStore(paths.enrichmentCheckpoint(), mapper);
    }

    private CheckpointStore generationCheckpoint() {
        return new FileCheckpointStore(paths.generationCheckpoint(), mapper);
    }

    private EnrichedWordRepository enrichedWords() {
        return new EnrichedWordRepository(paths.enrichedWordsJson(), mapper);
    }
}
