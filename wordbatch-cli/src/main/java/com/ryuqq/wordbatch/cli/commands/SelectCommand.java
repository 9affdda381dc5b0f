package com.ryuqq.wordbatch.cli.commands;

import com.ryuqq.wordbatch.cli.WordBatchCli;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * word_selection.csv에서 include=Y 단어를 골라 selected_words.csv 작성.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@Command(
    name = "select",
    description = "Select included words from word_selection.csv into data/selected_words.csv",
    mixinStandardHelpOptions = true
)
public class SelectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SelectCommand.class);

    @ParentCommand
    private WordBatchCli parent;

    @Override
    public Integer call() {
        List<VocabularyItem> selected = parent.factory().selectVocabulary();
        log.info("Selected {} words", selected.size());
        return 0;
    }
}
