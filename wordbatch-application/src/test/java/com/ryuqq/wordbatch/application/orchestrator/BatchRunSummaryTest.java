package com.ryuqq.wordbatch.application.orchestrator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BatchRunSummary 유닛 테스트.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class BatchRunSummaryTest {

    @Test
    void 실패가_없으면_종료코드_0() {
        // given
        BatchRunSummary summary = new BatchRunSummary(3, 1, List.of(), 200, null);

        // when & then
        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.exitCode()).isZero();
    }

    @Test
    void 실패가_있으면_종료코드_1() {
        // given
        BatchRunSummary summary = new BatchRunSummary(1, 0, List.of(4), 200, "wordbatch batch 4");

        // when & then
        assertThat(summary.isSuccess()).isFalse();
        assertThat(summary.exitCode()).isEqualTo(1);
        assertThat(summary.resumeCommand()).isEqualTo("wordbatch batch 4");
    }

    @Test
    void failed_null이면_빈_목록() {
        BatchRunSummary summary = new BatchRunSummary(0, 0, null, 0, null);

        assertThat(summary.failed()).isEmpty();
    }
}
