package com.ryuqq.wordbatch.adapter.file.enrichment;

import com.ryuqq.wordbatch.adapter.file.json.JsonMappers;
import com.ryuqq.wordbatch.core.model.EnrichedWord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichedWordRepositoryTest {

    @TempDir
    Path dir;

    @Test
    void save_load_delete() throws Exception {
        EnrichedWordRepository repository =
            new EnrichedWordRepository(dir.resolve("data/enriched_words.json"), JsonMappers.create());
        List<EnrichedWord> words = List.of(
            new EnrichedWord("serene", "/səˈriːn/", List.of("adjective")),
            EnrichedWord.bare("qwzx")
        );

        repository.save(words);

        assertThat(repository.load()).isEqualTo(words);
        assertThat(Files.readString(repository.getLocation())).contains("\"pos\"");

        repository.delete();

        assertThat(repository.exists()).isFalse();
        assertThat(repository.load()).isEmpty();
    }
}
