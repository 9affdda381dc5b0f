package com.ryuqq.wordbatch.testkit.stage;

import com.ryuqq.wordbatch.application.stage.GenerationReport;
import com.ryuqq.wordbatch.application.stage.GenerationStage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * 호출마다 미리 정해 둔 동작을 수행하는 GenerationStage.
 *
 * <p>동작 안에서 산출물 파일을 직접 쓰도록 스크립트를 구성할 수 있습니다.
 * 스크립트가 소진되면 마지막 동작을 반복합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class ScriptedGenerationStage implements GenerationStage {

    private final Deque<Supplier<GenerationReport>> script = new ArrayDeque<>();
    private Supplier<GenerationReport> last = () -> new GenerationReport(null, 0, null, 0);
    private final List<Boolean> resumeFlags = new ArrayList<>();

    public ScriptedGenerationStage then(Supplier<GenerationReport> action) {
        script.add(action);
        return this;
    }

    public ScriptedGenerationStage thenThrow(RuntimeException exception) {
        script.add(() -> {
            throw exception;
        });
        return this;
    }

    @Override
    public synchronized GenerationReport run(boolean resume) {
        resumeFlags.add(resume);
        if (!script.isEmpty()) {
            last = script.poll();
        }
        return last.get();
    }

    public synchronized List<Boolean> getResumeFlags() {
        return List.copyOf(resumeFlags);
    }

    public synchronized int invocationCount() {
        return resumeFlags.size();
    }
}
