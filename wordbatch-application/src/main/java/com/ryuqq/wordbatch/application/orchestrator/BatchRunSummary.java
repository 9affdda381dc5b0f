package com.ryuqq.wordbatch.application.orchestrator;

import java.util.List;

/**
 * 배치 실행 요약.
 *
 * @param processed 처리(또는 기존 산출물로 성공 처리)된 배치 수
 * @param skipped 항목이 없어 건너뛴 배치 수
 * @param failed 실패한 배치 번호 (fail-fast이므로 최대 1개)
 * @param totalBatches 전체 배치 수
 * @param resumeCommand 실패 시 재개 명령, 성공 시 null
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record BatchRunSummary(
    int processed,
    int skipped,
    List<Integer> failed,
    int totalBatches,
    String resumeCommand
) {

    public BatchRunSummary {
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    /**
     * 프로세스 종료 코드.
     *
     * @return 실패가 없으면 0, 있으면 1
     */
    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }
}
