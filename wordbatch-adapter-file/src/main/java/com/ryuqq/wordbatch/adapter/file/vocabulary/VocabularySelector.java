package com.ryuqq.wordbatch.adapter.file.vocabulary;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 어휘 선택: {@code word_selection.csv} 에서 include == "Y" 인 단어만 골라
 * 빈도순으로 {@code selected_words.csv} 에 기록합니다.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class VocabularySelector {

    private static final Logger log = LoggerFactory.getLogger(VocabularySelector.class);

    private final CsvMapper csvMapper;

    public VocabularySelector() {
        this(new CsvMapper());
    }

    public VocabularySelector(CsvMapper csvMapper) {
        if (csvMapper == null) {
            throw new IllegalArgumentException("csvMapper cannot be null");
        }
        this.csvMapper = csvMapper;
    }

    /**
     * 선택 실행.
     *
     * @param input 입력 CSV (frequency,word,include)
     * @param output 출력 CSV (frequency,word)
     * @return 출력 순서대로 rowIndex가 매겨진 선택 결과
     * @throws ConfigurationException 입력 파일이 없는 경우
     */
    public List<VocabularyItem> select(Path input, Path output) {
        if (!Files.isRegularFile(input)) {
            throw new ConfigurationException("Word selection file not found: " + input);
        }
        List<Map<String, String>> rows = VocabularyRepository.readRows(csvMapper, input);

        List<VocabularyItem> selected = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String word = row.get("word");
            if (!"Y".equals(row.get("include")) || word == null || word.isBlank()) {
                continue;
            }
            selected.add(new VocabularyItem(0, VocabularyRepository.parseFrequency(row.get("frequency"), i, input), word.strip()));
        }
        selected.sort(Comparator.comparingInt(VocabularyItem::frequency));

        List<VocabularyItem> indexed = new ArrayList<>(selected.size());
        List<Map<String, Object>> outputRows = new ArrayList<>(selected.size());
        for (VocabularyItem item : selected) {
            indexed.add(new VocabularyItem(indexed.size(), item.frequency(), item.word()));
            Map<String, Object> outputRow = new LinkedHashMap<>();
            outputRow.put("frequency", item.frequency());
            outputRow.put("word", item.word());
            outputRows.add(outputRow);
        }

        write(output, outputRows);
        log.info("Selected {} of {} words -> {}", indexed.size(), rows.size(), output);
        return indexed;
    }

    private void write(Path output, List<Map<String, Object>> rows) {
        CsvSchema schema = CsvSchema.builder()
            .addColumn("frequency", CsvSchema.ColumnType.NUMBER)
            .addColumn("word")
            .build()
            .withHeader();
        try {
            Path parent = output.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            try (SequenceWriter writer = csvMapper.writer(schema).writeValues(output.toFile())) {
                writer.writeAll(rows);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
    }
}
