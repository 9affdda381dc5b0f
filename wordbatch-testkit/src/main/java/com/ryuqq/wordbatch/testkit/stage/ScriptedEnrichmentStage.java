package com.ryuqq.wordbatch.testkit.stage;

import com.ryuqq.wordbatch.application.stage.EnrichmentStage;
import com.ryuqq.wordbatch.core.model.EnrichedWord;
import com.ryuqq.wordbatch.core.model.RowRange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * 호출마다 미리 정해 둔 동작을 수행하는 EnrichmentStage.
 *
 * <p>스크립트가 소진되면 마지막 동작을 반복합니다. 스크립트가 비어 있으면
 * 구간 크기만큼 bare 단어를 반환합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class ScriptedEnrichmentStage implements EnrichmentStage {

    private final Deque<Function<RowRange, List<EnrichedWord>>> script = new ArrayDeque<>();
    private Function<RowRange, List<EnrichedWord>> last = ScriptedEnrichmentStage::bareWords;
    private final List<RowRange> invocations = new ArrayList<>();
    private final List<Boolean> resumeFlags = new ArrayList<>();

    public ScriptedEnrichmentStage thenReturnBareWords() {
        script.add(ScriptedEnrichmentStage::bareWords);
        return this;
    }

    public ScriptedEnrichmentStage thenThrow(RuntimeException exception) {
        script.add(range -> {
            throw exception;
        });
        return this;
    }

    @Override
    public synchronized List<EnrichedWord> run(RowRange range, boolean resume) {
        invocations.add(range);
        resumeFlags.add(resume);
        if (!script.isEmpty()) {
            last = script.poll();
        }
        return last.apply(range);
    }

    public synchronized List<RowRange> getInvocations() {
        return List.copyOf(invocations);
    }

    public synchronized List<Boolean> getResumeFlags() {
        return List.copyOf(resumeFlags);
    }

    public synchronized int invocationCount() {
        return invocations.size();
    }

    private static List<EnrichedWord> bareWords(RowRange range) {
        List<EnrichedWord> words = new ArrayList<>();
        for (int i = range.start(); i < range.end(); i++) {
            words.add(EnrichedWord.bare("word" + i));
        }
        return words;
    }
}
