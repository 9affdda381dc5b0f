package com.ryuqq.wordbatch.application.scheduler;

import java.util.List;

/**
 * 스케줄 실행 요약.
 *
 * @param successful 성공한 bucket 번호
 * @param failed 실패한 bucket 번호
 * @param skipped 시간이 지나 건너뛴 bucket 번호
 * @param totalBuckets 전체 bucket 수
 * @param nothingToDo 시작 시점에 이미 종료 시각이 지났는지 여부
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record ScheduleSummary(
    List<Integer> successful,
    List<Integer> failed,
    List<Integer> skipped,
    int totalBuckets,
    boolean nothingToDo
) {

    public ScheduleSummary {
        successful = successful == null ? List.of() : List.copyOf(successful);
        failed = failed == null ? List.of() : List.copyOf(failed);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static ScheduleSummary nothingToDo(int totalBuckets) {
        return new ScheduleSummary(List.of(), List.of(), List.of(), totalBuckets, true);
    }

    public int exitCode() {
        return failed.isEmpty() ? 0 : 1;
    }
}
