package com.ryuqq.wordbatch.adapter.runner;

import com.ryuqq.wordbatch.application.orchestrator.BatchRunSummary;
import com.ryuqq.wordbatch.application.runtime.PartitionRunner;
import com.ryuqq.wordbatch.core.model.Partition;
import com.ryuqq.wordbatch.core.model.PartitionMode;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import com.ryuqq.wordbatch.core.partition.PartitionCalculator;
import com.ryuqq.wordbatch.core.partition.PartitionConfig;
import com.ryuqq.wordbatch.testkit.time.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SequentialBatchOrchestrator 유닛 테스트.
 *
 * <p>어휘 빈도: 배치 0 (1-100), 배치 1 (101-200), 배치 3 (301-400)에만 단어가 있고
 * 배치 2와 4는 비어 있습니다. maxFrequency=500 이므로 전체 5개 배치입니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SequentialBatchOrchestratorTest {

    @Mock
    private PartitionRunner runner;

    private RecordingSleeper sleeper;
    private SequentialBatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        List<VocabularyItem> vocabulary = List.of(
            new VocabularyItem(0, 5, "the"),
            new VocabularyItem(1, 150, "serene"),
            new VocabularyItem(2, 199, "ardent"),
            new VocabularyItem(3, 350, "lucid")
        );
        PartitionCalculator calculator =
            new PartitionCalculator(new PartitionConfig(PartitionMode.FREQUENCY, 100, 500));
        sleeper = new RecordingSleeper();
        orchestrator = new SequentialBatchOrchestrator(vocabulary, calculator, runner, new RetryConfig(), sleeper);
    }

    @Test
    void runFrom_전체_성공() {
        // given
        when(runner.runPartition(any(), anyBoolean())).thenReturn(true);

        // when
        BatchRunSummary summary = orchestrator.runFrom(0, OptionalInt.empty(), false);

        // then
        assertThat(summary.processed()).isEqualTo(3);
        assertThat(summary.skipped()).isEqualTo(2);
        assertThat(summary.failed()).isEmpty();
        assertThat(summary.totalBatches()).isEqualTo(5);
        assertThat(summary.resumeCommand()).isNull();
        assertThat(summary.exitCode()).isZero();
        assertThat(sleeper.getSleeps()).containsOnly(Duration.ofSeconds(5)).hasSize(3);

        ArgumentCaptor<Partition> captor = ArgumentCaptor.forClass(Partition.class);
        verify(runner, times(3)).runPartition(captor.capture(), eq(false));
        assertThat(captor.getAllValues()).extracting(Partition::label)
            .containsExactly("1-100", "101-200", "301-400");
    }

    @Test
    void runFrom_첫_실패에서_중단하고_재개_명령_반환() {
        // given
        when(runner.runPartition(any(), anyBoolean()))
            .thenAnswer(invocation -> ((Partition) invocation.getArgument(0)).index() != 1);

        // when
        BatchRunSummary summary = orchestrator.runFrom(0, OptionalInt.empty(), false);

        // then
        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.failed()).containsExactly(1);
        assertThat(summary.resumeCommand()).isEqualTo("wordbatch batch 1 --max-frequency 500");
        assertThat(summary.exitCode()).isEqualTo(1);
        verify(runner, times(2)).runPartition(any(), anyBoolean());
        assertThat(sleeper.getSleeps()).hasSize(1);
    }

    @Test
    void runFrom_재개_명령에_기본값이_아닌_분할_설정을_포함() {
        // given: 400 rows in ROW mode with 50 rows per batch
        List<VocabularyItem> rows = new ArrayList<>();
        for (int row = 0; row < 400; row++) {
            rows.add(new VocabularyItem(row, row + 1, "word" + row));
        }
        PartitionCalculator rowCalculator =
            new PartitionCalculator(new PartitionConfig(PartitionMode.ROW, 50, 20000));
        SequentialBatchOrchestrator rowOrchestrator =
            new SequentialBatchOrchestrator(rows, rowCalculator, runner, new RetryConfig(), sleeper);
        when(runner.runPartition(any(), anyBoolean())).thenReturn(false);

        // when
        BatchRunSummary summary = rowOrchestrator.runFrom(7, OptionalInt.empty(), false);

        // then
        assertThat(summary.failed()).containsExactly(7);
        assertThat(summary.resumeCommand()).isEqualTo("wordbatch batch 7 --mode ROW --batch-size 50");
    }

    @Test
    void runFrom_기본_분할_설정이면_재개_명령은_인덱스만() {
        // given
        List<VocabularyItem> words = List.of(new VocabularyItem(0, 150, "serene"));
        SequentialBatchOrchestrator defaultOrchestrator = new SequentialBatchOrchestrator(
            words, new PartitionCalculator(new PartitionConfig()), runner, new RetryConfig(), sleeper
        );
        when(runner.runPartition(any(), anyBoolean())).thenReturn(false);

        // when
        BatchRunSummary summary = defaultOrchestrator.runFrom(1, OptionalInt.of(1), false);

        // then
        assertThat(summary.resumeCommand()).isEqualTo("wordbatch batch 1");
    }

    @Test
    void runFrom_count만큼만_실행() {
        // given
        when(runner.runPartition(any(), anyBoolean())).thenReturn(true);

        // when
        BatchRunSummary summary = orchestrator.runFrom(1, OptionalInt.of(2), true);

        // then: 배치 1 처리, 배치 2 비어 있음
        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        verify(runner).runPartition(argThat(partition -> partition.index() == 1), eq(true));
        verifyNoMoreInteractions(runner);
        assertThat(sleeper.getSleeps()).hasSize(1);
    }

    @Test
    void runFrom_count가_전체를_넘으면_마지막_배치에서_종료() {
        // given
        when(runner.runPartition(any(), anyBoolean())).thenReturn(true);

        // when
        BatchRunSummary summary = orchestrator.runFrom(3, OptionalInt.of(100), false);

        // then
        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
    }

    @Test
    void runFrom_시작_배치가_전체를_넘으면_아무것도_하지_않음() {
        BatchRunSummary summary = orchestrator.runFrom(10, OptionalInt.empty(), false);

        assertThat(summary.processed()).isZero();
        assertThat(summary.skipped()).isZero();
        assertThat(summary.isSuccess()).isTrue();
        verifyNoInteractions(runner);
    }

    @Test
    void runFrom_잘못된_인자() {
        assertThatThrownBy(() -> orchestrator.runFrom(-1, OptionalInt.empty(), false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.runFrom(0, OptionalInt.of(0), false))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
