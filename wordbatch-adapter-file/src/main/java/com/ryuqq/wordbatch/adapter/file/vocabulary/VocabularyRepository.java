package com.ryuqq.wordbatch.adapter.file.vocabulary;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.core.model.VocabularyItem;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 어휘 목록 로더.
 *
 * <p><strong>지원 형식:</strong></p>
 * <ul>
 *   <li>{@code .csv}: 헤더 {@code frequency,word}. 행 순서가 rowIndex</li>
 *   <li>{@code .txt}: 한 줄에 한 단어, 빈 줄 무시. frequency = rowIndex + 1</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class VocabularyRepository {

    private final CsvMapper csvMapper;

    public VocabularyRepository() {
        this(new CsvMapper());
    }

    public VocabularyRepository(CsvMapper csvMapper) {
        if (csvMapper == null) {
            throw new IllegalArgumentException("csvMapper cannot be null");
        }
        this.csvMapper = csvMapper;
    }

    /**
     * 어휘 파일 읽기.
     *
     * @param source 어휘 파일 (.csv 또는 .txt)
     * @return 파일 순서대로 rowIndex가 매겨진 항목
     * @throws ConfigurationException 파일이 없거나 필수 열/값이 잘못된 경우
     */
    public List<VocabularyItem> load(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new ConfigurationException("Vocabulary file not found: " + source);
        }
        if (source.getFileName().toString().endsWith(".txt")) {
            return loadText(source);
        }
        return loadCsv(source);
    }

    private List<VocabularyItem> loadText(Path source) {
        List<VocabularyItem> items = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(source, StandardCharsets.UTF_8)) {
                String word = line.strip();
                if (!word.isEmpty()) {
                    items.add(new VocabularyItem(items.size(), items.size() + 1, word));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read vocabulary " + source, e);
        }
        return items;
    }

    private List<VocabularyItem> loadCsv(Path source) {
        List<VocabularyItem> items = new ArrayList<>();
        for (Map<String, String> row : readRows(csvMapper, source)) {
            int rowIndex = items.size();
            String word = row.get("word");
            if (word == null || word.isBlank()) {
                throw new ConfigurationException("Missing word at row " + rowIndex + " in " + source);
            }
            items.add(new VocabularyItem(rowIndex, parseFrequency(row.get("frequency"), rowIndex, source), word.strip()));
        }
        return items;
    }

    /**
     * 헤더가 있는 CSV를 행 단위 Map으로 읽기.
     *
     * @param csvMapper CSV 매퍼
     * @param source CSV 파일
     * @return 행 목록
     */
    static List<Map<String, String>> readRows(CsvMapper csvMapper, Path source) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator = csvMapper
            .readerForMapOf(String.class)
            .with(schema)
            .readValues(source.toFile())) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV " + source, e);
        }
    }

    static int parseFrequency(String value, int rowIndex, Path source) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing frequency at row " + rowIndex + " in " + source);
        }
        String trimmed = value.strip();
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            try {
                // 스프레드시트에서 내보낸 "12.0" 형태 허용
                return (int) Double.parseDouble(trimmed);
            } catch (NumberFormatException notDecimal) {
                throw new ConfigurationException(
                    "Invalid frequency '" + value + "' at row " + rowIndex + " in " + source, e
                );
            }
        }
    }
}
