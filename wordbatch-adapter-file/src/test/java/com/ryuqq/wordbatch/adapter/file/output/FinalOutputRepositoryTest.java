package com.ryuqq.wordbatch.adapter.file.output;

import com.ryuqq.wordbatch.adapter.file.json.JsonMappers;
import com.ryuqq.wordbatch.core.model.ExampleSentence;
import com.ryuqq.wordbatch.core.model.FinalEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FinalOutputRepository 테스트.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class FinalOutputRepositoryTest {

    @TempDir
    Path dir;

    private FinalOutputRepository repositoryAt(LocalDateTime now) {
        Clock clock = Clock.fixed(now.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new FinalOutputRepository(dir, JsonMappers.create(), clock);
    }

    @Test
    void newArtifactPath_타임스탬프_이름() {
        FinalOutputRepository repository = repositoryAt(LocalDateTime.of(2026, 1, 31, 14, 30, 22));

        assertThat(repository.newArtifactPath().getFileName().toString())
            .isEqualTo("final_output_20260131_143022.json");
    }

    @Test
    void save_후_load하면_필드_이름과_순서가_유지된다() throws Exception {
        // given
        FinalOutputRepository repository = repositoryAt(LocalDateTime.of(2026, 1, 31, 14, 30, 22));
        Path artifact = repository.newArtifactPath();
        FinalEntry entry = new FinalEntry(
            "serene", "/səˈriːn/", List.of("adjective"), "adjective", "calm and peaceful",
            List.of(new ExampleSentence("The lake was serene.", "Formal", "호수는 고요했다.", "고요했다", 1))
        );

        // when
        repository.save(artifact, List.of(entry, new FinalEntry("brisk", null, null, "adjective", "quick", null)));
        List<FinalEntry> loaded = repository.load(artifact);

        // then
        assertThat(loaded).extracting(FinalEntry::word).containsExactly("serene", "brisk");
        assertThat(loaded.get(0)).isEqualTo(entry);
        assertThat(Files.readString(artifact)).contains("\"selected_pos\"", "\"translated_word\"", "\"display_order\"");
    }

    @Test
    void latestArtifact_이름순_마지막() throws Exception {
        // given
        Files.writeString(dir.resolve("final_output_20260101_090000.json"), "[]");
        Files.writeString(dir.resolve("final_output_20260102_090000.json"), "[]");
        Files.writeString(dir.resolve("enriched_words.json"), "[]");

        // when & then
        FinalOutputRepository repository = repositoryAt(LocalDateTime.now());
        assertThat(repository.findArtifacts()).hasSize(2);
        assertThat(repository.latestArtifact())
            .contains(dir.resolve("final_output_20260102_090000.json"));
    }

    @Test
    void 없는_폴더와_파일은_빈_결과() {
        assertThat(FinalOutputRepository.findArtifacts(dir.resolve("missing"))).isEmpty();
        assertThat(repositoryAt(LocalDateTime.now()).load(dir.resolve("missing.json"))).isEmpty();
    }
}
