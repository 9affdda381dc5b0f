package com.ryuqq.wordbatch.adapter.file.enrichment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.adapter.file.json.AtomicFiles;
import com.ryuqq.wordbatch.core.model.EnrichedWord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 보강 중간 결과 파일 ({@code enriched_words.json}).
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class EnrichedWordRepository {

    private static final TypeReference<List<EnrichedWord>> WORD_LIST = new TypeReference<>() {
    };

    private final Path location;
    private final ObjectMapper mapper;

    public EnrichedWordRepository(Path location, ObjectMapper mapper) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.location = location;
        this.mapper = mapper;
    }

    /**
     * @return 저장된 보강 결과, 파일이 없으면 빈 목록
     */
    public List<EnrichedWord> load() {
        if (!Files.exists(location)) {
            return List.of();
        }
        try {
            List<EnrichedWord> words = mapper.readValue(location.toFile(), WORD_LIST);
            return words == null ? List.of() : words;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + location, e);
        }
    }

    public void save(List<EnrichedWord> words) {
        try {
            AtomicFiles.write(location, mapper.writeValueAsBytes(words));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + location, e);
        }
    }

    public void delete() {
        try {
            Files.deleteIfExists(location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + location, e);
        }
    }

    public boolean exists() {
        return Files.exists(location);
    }

    public Path getLocation() {
        return location;
    }
}
