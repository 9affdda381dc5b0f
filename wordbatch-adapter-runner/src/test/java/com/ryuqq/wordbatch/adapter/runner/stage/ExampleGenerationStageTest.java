package com.ryuqq.wordbatch.adapter.runner.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.adapter.file.enrichment.EnrichedWordRepository;
import com.ryuqq.wordbatch.adapter.file.json.JsonMappers;
import com.ryuqq.wordbatch.adapter.file.output.FinalOutputRepository;
import com.ryuqq.wordbatch.adapter.file.prompt.PromptTemplateLoader;
import com.ryuqq.wordbatch.adapter.runner.GenerationStageConfig;
import com.ryuqq.wordbatch.application.stage.GenerationReport;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.core.exception.GenerationException;
import com.ryuqq.wordbatch.core.exception.GenerationTimeoutException;
import com.ryuqq.wordbatch.core.exception.MalformedResponseException;
import com.ryuqq.wordbatch.core.exception.SystemicFailureException;
import com.ryuqq.wordbatch.core.model.EnrichedWord;
import com.ryuqq.wordbatch.core.model.ExampleSentence;
import com.ryuqq.wordbatch.core.model.FinalEntry;
import com.ryuqq.wordbatch.core.model.GenerationResult;
import com.ryuqq.wordbatch.core.spi.GenerationClient;
import com.ryuqq.wordbatch.testkit.store.InMemoryCheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExampleGenerationStage 테스트.
 *
 * <p>생성 클라이언트는 단어 이름으로 동작을 고르는 람다입니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class ExampleGenerationStageTest {

    private static final Instant NOW = Instant.parse("2026-01-31T14:30:22Z");

    @TempDir
    Path root;

    private final ObjectMapper mapper = JsonMappers.create();
    private final Set<String> failing = new HashSet<>();
    private final Set<String> malformed = new HashSet<>();
    private final List<String> requested = new ArrayList<>();

    private InMemoryCheckpointStore checkpoint;
    private EnrichedWordRepository enrichedWords;
    private FinalOutputRepository outputs;
    private PromptTemplateLoader promptLoader;

    private final GenerationClient client = (word, partsOfSpeech, template) -> {
        requested.add(word);
        if (failing.contains(word)) {
            throw new GenerationException("Generation exited with code 1");
        }
        if (malformed.contains(word)) {
            throw new MalformedResponseException("Missing field: definition");
        }
        return result(word);
    };

    @BeforeEach
    void setUp() throws IOException {
        Path dataDir = root.resolve("data");
        checkpoint = new InMemoryCheckpointStore();
        enrichedWords = new EnrichedWordRepository(dataDir.resolve("enriched_words.json"), mapper);
        outputs = new FinalOutputRepository(dataDir, mapper, Clock.fixed(NOW, ZoneOffset.UTC));
        Path template = root.resolve("prompt.txt");
        Files.writeString(template, "Write examples for {word} ({pos})");
        promptLoader = new PromptTemplateLoader(template);
    }

    private static GenerationResult result(String word) {
        List<ExampleSentence> examples = new ArrayList<>();
        for (int i = 0; i < EntryValidator.EXAMPLE_STYLES.size(); i++) {
            examples.add(new ExampleSentence(
                "A " + word + " sentence " + i, EntryValidator.EXAMPLE_STYLES.get(i), "번역 " + word, word, i + 1
            ));
        }
        return new GenerationResult("adjective", "definition of " + word, examples);
    }

    private void enrich(int count) {
        List<EnrichedWord> words = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            words.add(new EnrichedWord("word" + i, "/w" + i + "/", List.of("adjective")));
        }
        enrichedWords.save(words);
    }

    private ExampleGenerationStage stage(GenerationStageConfig config) {
        return new ExampleGenerationStage(client, checkpoint, enrichedWords, outputs, promptLoader, config);
    }

    @Test
    void 모든_단어_생성_후_산출물_저장() {
        // given
        enrich(3);

        // when
        GenerationReport report = stage(new GenerationStageConfig()).run(false);

        // then
        assertThat(report.artifact()).isEqualTo(root.resolve("data/final_output_20260131_143022.json"));
        assertThat(report.generated()).isEqualTo(3);
        assertThat(report.failed()).isZero();
        assertThat(report.totalEntries()).isEqualTo(3);

        List<FinalEntry> saved = outputs.load(report.artifact());
        assertThat(saved).extracting(FinalEntry::word).containsExactly("word0", "word1", "word2");
        assertThat(saved.get(0).phonetic()).isEqualTo("/w0/");
        assertThat(saved.get(0).examples()).hasSize(9);
        assertThat(checkpoint.processedCount()).isEqualTo(3);
    }

    @Test
    void 형식_오류는_연속_실패를_초기화() {
        // given: 실패, 형식 오류, 실패 순서라 연속 실패가 2에 도달하지 않음
        enrich(5);
        failing.add("word1");
        malformed.add("word2");
        failing.add("word3");

        // when
        GenerationReport report = stage(new GenerationStageConfig()).run(false);

        // then
        assertThat(report.generated()).isEqualTo(2);
        assertThat(report.failedWords()).containsExactly("word1", "word2", "word3");
        assertThat(checkpoint.failedKeys()).containsExactly("word1", "word2", "word3");
        assertThat(checkpoint.processedCount()).isEqualTo(2);
        assertThat(outputs.load(report.artifact())).extracting(FinalEntry::word).containsExactly("word0", "word4");
    }

    @Test
    void 연속_실패_시_중단하고_마지막_저장_이후_결과는_버림() {
        // given: 0~10 성공, 11과 12 연속 실패
        enrich(14);
        failing.add("word11");
        failing.add("word12");

        // when & then
        assertThatThrownBy(() -> stage(new GenerationStageConfig()).run(false))
            .isInstanceOf(SystemicFailureException.class)
            .hasMessageContaining("2 consecutive")
            .satisfies(e -> assertThat(((SystemicFailureException) e).getConsecutiveFailures()).isEqualTo(2));

        assertThat(requested).hasSize(13);
        Path artifact = root.resolve("data/final_output_20260131_143022.json");
        assertThat(outputs.load(artifact)).hasSize(10);
        assertThat(checkpoint.processedCount()).isEqualTo(10);
        assertThat(checkpoint.isProcessed("word10")).isFalse();
    }

    @Test
    void 타임아웃도_연속_실패로_계산() {
        // given
        enrich(3);
        GenerationClient timingOut = (word, partsOfSpeech, template) -> {
            throw new GenerationTimeoutException("Generation timed out after 3 attempts");
        };
        ExampleGenerationStage stage = new ExampleGenerationStage(
            timingOut, checkpoint, enrichedWords, outputs, promptLoader, new GenerationStageConfig()
        );

        // when & then
        assertThatThrownBy(() -> stage.run(false)).isInstanceOf(SystemicFailureException.class);
        assertThat(checkpoint.failedCount()).isEqualTo(2);
    }

    @Test
    void resume_시_최신_산출물에_이어서_생성() {
        // given
        enrich(4);
        FinalOutputRepository earlier = new FinalOutputRepository(
            root.resolve("data"), mapper, Clock.fixed(NOW.minusSeconds(3600), ZoneOffset.UTC)
        );
        Path existing = earlier.newArtifactPath();
        earlier.save(existing, List.of(
            FinalEntry.of(new EnrichedWord("word0", null, List.of()), result("word0")),
            FinalEntry.of(new EnrichedWord("word1", null, List.of()), result("word1"))
        ));
        checkpoint.markProcessed("word0", 0);
        checkpoint.markProcessed("word1", 1);

        // when
        GenerationReport report = stage(new GenerationStageConfig()).run(true);

        // then
        assertThat(requested).containsExactly("word2", "word3");
        assertThat(report.artifact()).isEqualTo(existing);
        assertThat(report.totalEntries()).isEqualTo(4);
        assertThat(outputs.load(existing)).extracting(FinalEntry::word)
            .containsExactly("word0", "word1", "word2", "word3");
        assertThat(outputs.findArtifacts()).containsExactly(existing);
    }

    @Test
    void resume_시_남은_단어가_없으면_기존_산출물_보고() {
        // given
        enrich(1);
        Path existing = outputs.newArtifactPath();
        outputs.save(existing, List.of(FinalEntry.of(new EnrichedWord("word0", null, List.of()), result("word0"))));
        checkpoint.markProcessed("word0", 0);

        // when
        GenerationReport report = stage(new GenerationStageConfig()).run(true);

        // then
        assertThat(requested).isEmpty();
        assertThat(report.artifact()).isEqualTo(existing);
        assertThat(report.generated()).isZero();
        assertThat(report.totalEntries()).isEqualTo(1);
    }

    @Test
    void 새_실행은_체크포인트를_초기화() {
        // given
        enrich(2);
        checkpoint.markProcessed("word0", 0);

        // when
        stage(new GenerationStageConfig()).run(false);

        // then
        assertThat(requested).containsExactly("word0", "word1");
    }

    @Test
    void dryRun은_앞_10개만_생성() {
        // given
        enrich(12);

        // when
        GenerationReport report = stage(new GenerationStageConfig().withDryRun(true)).run(false);

        // then
        assertThat(report.generated()).isEqualTo(10);
        assertThat(requested).doesNotContain("word10", "word11");
    }

    @Test
    void 검증_경고가_있어도_항목은_저장() {
        // given
        enrich(1);
        GenerationClient sparse = (word, partsOfSpeech, template) ->
            new GenerationResult("noun", "def", List.of(new ExampleSentence("A — B", "Formal", "번역", "없음", 1)));
        ExampleGenerationStage stage = new ExampleGenerationStage(
            sparse, checkpoint, enrichedWords, outputs, promptLoader, new GenerationStageConfig()
        );

        // when
        GenerationReport report = stage.run(false);

        // then
        assertThat(report.generated()).isEqualTo(1);
        assertThat(outputs.load(report.artifact())).hasSize(1);
    }

    @Test
    void 프롬프트_템플릿이_없으면_ConfigurationException() {
        // given
        enrich(1);
        ExampleGenerationStage stage = new ExampleGenerationStage(
            client, checkpoint, enrichedWords, outputs,
            new PromptTemplateLoader(root.resolve("missing.txt")), new GenerationStageConfig()
        );

        // when & then
        assertThatThrownBy(() -> stage.run(false))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Prompt template not found");
        assertThat(requested).isEmpty();
    }
}
