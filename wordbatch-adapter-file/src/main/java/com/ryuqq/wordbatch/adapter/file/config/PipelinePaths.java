package com.ryuqq.wordbatch.adapter.file.config;

import java.nio.file.Path;

/**
 * 파이프라인 파일 배치 설정 (불변 record).
 *
 * <p><strong>기본 레이아웃 (root 기준):</strong></p>
 * <pre>
 * word_selection.csv                  선택 원본 (frequency,word,include)
 * data/selected_words.csv             선택된 어휘 (frequency,word)
 * data/enriched_words.json            보강 중간 결과
 * data/final_output_*.json            생성 산출물 (작업 폴더)
 * data/stale/                         앞선 파티션이 회수하지 못한 산출물
 * checkpoints/step2_progress.json     보강 체크포인트
 * checkpoints/step3_progress.json     생성 체크포인트
 * prompts/example_generation.txt      프롬프트 템플릿
 * final_data/{label}/                 파티션별 최종 산출물
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 * @param root 프로젝트 루트
 * @param dataDir 작업 폴더
 * @param checkpointsDir 체크포인트 폴더
 * @param promptsDir 프롬프트 폴더
 * @param finalDataDir 파티션별 최종 산출물 폴더
 */
public record PipelinePaths(
    Path root,
    Path dataDir,
    Path checkpointsDir,
    Path promptsDir,
    Path finalDataDir
) {

    /**
     * 현재 디렉터리를 루트로 하는 기본 설정.
     */
    public PipelinePaths() {
        this(Path.of("."));
    }

    /**
     * 루트 아래 기본 레이아웃.
     *
     * @param root 프로젝트 루트
     */
    public PipelinePaths(Path root) {
        this(
            root,
            root.resolve("data"),
            root.resolve("checkpoints"),
            root.resolve("prompts"),
            root.resolve("final_data")
        );
    }

    public PipelinePaths {
        if (root == null || dataDir == null || checkpointsDir == null
            || promptsDir == null || finalDataDir == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
    }

    public Path wordSelectionCsv() {
        return root.resolve("word_selection.csv");
    }

    public Path selectedWordsCsv() {
        return dataDir.resolve("selected_words.csv");
    }

    public Path enrichedWordsJson() {
        return dataDir.resolve("enriched_words.json");
    }

    /**
     * 새 파티션을 시작할 때 작업 폴더에 남아 있던 산출물을 옮겨 두는 폴더.
     *
     * @return data/stale
     */
    public Path staleDir() {
        return dataDir.resolve("stale");
    }

    public Path enrichmentCheckpoint() {
        return checkpointsDir.resolve("step2_progress.json");
    }

    public Path generationCheckpoint() {
        return checkpointsDir.resolve("step3_progress.json");
    }

    public Path promptTemplate() {
        return promptsDir.resolve("example_generation.txt");
    }

    /**
     * 파티션 label에 해당하는 최종 산출물 폴더.
     *
     * @param label 파티션 label (예: "101-200")
     * @return final_data/{label}
     */
    public Path partitionDir(String label) {
        return finalDataDir.resolve(label);
    }

    public PipelinePaths withFinalDataDir(Path finalDataDir) {
        return new PipelinePaths(root, dataDir, checkpointsDir, promptsDir, finalDataDir);
    }

    public PipelinePaths withDataDir(Path dataDir) {
        return new PipelinePaths(root, dataDir, checkpointsDir, promptsDir, finalDataDir);
    }
}
