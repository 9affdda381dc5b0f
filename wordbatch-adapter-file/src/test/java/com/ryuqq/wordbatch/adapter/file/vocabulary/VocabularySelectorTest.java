package com.ryuqq.wordbatch.adapter.file.vocabulary;

import com.ryuqq.wordbatch.core.model.VocabularyItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * VocabularySelector 테스트.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class VocabularySelectorTest {

    @TempDir
    Path dir;

    @Test
    void include_Y만_빈도순으로_기록() throws Exception {
        // given
        Path input = dir.resolve("word_selection.csv");
        Files.writeString(input, String.join("\n",
            "frequency,word,include",
            "30,gamma,Y",
            "10,alpha,Y",
            "20,beta,N",
            "5,,Y",
            "15,delta,Y",
            ""
        ));
        Path output = dir.resolve("data/selected_words.csv");

        // when
        List<VocabularyItem> selected = new VocabularySelector().select(input, output);

        // then
        assertThat(selected).extracting(VocabularyItem::word).containsExactly("alpha", "delta", "gamma");
        assertThat(selected).extracting(VocabularyItem::rowIndex).containsExactly(0, 1, 2);

        List<VocabularyItem> reloaded = new VocabularyRepository().load(output);
        assertThat(reloaded).isEqualTo(selected);
        assertThat(Files.readAllLines(output).get(0)).isEqualTo("frequency,word");
    }
}
