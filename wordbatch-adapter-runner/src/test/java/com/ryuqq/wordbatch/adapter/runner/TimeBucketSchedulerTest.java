package com.ryuqq.wordbatch.adapter.runner;

import com.ryuqq.wordbatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.wordbatch.application.orchestrator.BatchRunSummary;
import com.ryuqq.wordbatch.application.scheduler.ScheduleSummary;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import com.ryuqq.wordbatch.testkit.time.MutableClock;
import com.ryuqq.wordbatch.testkit.time.RecordingSleeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * TimeBucketScheduler 테스트.
 *
 * <p>스케줄: 09:00 ~ 12:00, 1시간 간격 → bucket 4개 (09, 10, 11, 12시).
 * RecordingSleeper가 MutableClock을 앞으로 돌립니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TimeBucketSchedulerTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 2, 10, 9, 0);
    private static final LocalDateTime END = LocalDateTime.of(2026, 2, 10, 12, 0);
    private static final BatchRunSummary OK = new BatchRunSummary(10, 0, List.of(), 200, null);
    private static final BatchRunSummary FAILED = new BatchRunSummary(2, 0, List.of(32), 200, "wordbatch batch 32");

    @Mock
    private BatchOrchestrator orchestrator;

    private final SchedulerConfig config = new SchedulerConfig(START, END, Duration.ofHours(1), 20, 10, false);

    @Test
    void 시작_전이면_첫_bucket까지_대기_후_모든_bucket_실행() {
        // given
        MutableClock clock = MutableClock.at(START.minusMinutes(30), ZoneOffset.UTC);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        when(orchestrator.runFrom(anyInt(), any(), anyBoolean())).thenReturn(OK);

        // when
        ScheduleSummary summary = new TimeBucketScheduler(orchestrator, config, clock, sleeper).run();

        // then
        assertThat(summary.successful()).containsExactly(0, 1, 2, 3);
        assertThat(summary.failed()).isEmpty();
        assertThat(summary.skipped()).isEmpty();
        assertThat(summary.totalBuckets()).isEqualTo(4);
        assertThat(summary.exitCode()).isZero();
        assertThat(sleeper.getSleeps()).containsExactly(
            Duration.ofMinutes(30), Duration.ofHours(1), Duration.ofHours(1), Duration.ofHours(1)
        );

        var inOrder = inOrder(orchestrator);
        inOrder.verify(orchestrator).runFrom(20, OptionalInt.of(10), false);
        inOrder.verify(orchestrator).runFrom(30, OptionalInt.of(10), false);
        inOrder.verify(orchestrator).runFrom(40, OptionalInt.of(10), false);
        inOrder.verify(orchestrator).runFrom(50, OptionalInt.of(10), false);
    }

    @Test
    void 실패한_bucket은_기록하고_다음_bucket_계속() {
        // given
        MutableClock clock = MutableClock.at(START, ZoneOffset.UTC);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        when(orchestrator.runFrom(anyInt(), any(), anyBoolean())).thenReturn(OK);
        when(orchestrator.runFrom(eq(30), any(), anyBoolean())).thenReturn(FAILED);
        when(orchestrator.runFrom(eq(40), any(), anyBoolean())).thenThrow(new IllegalStateException("boom"));

        // when
        ScheduleSummary summary = new TimeBucketScheduler(orchestrator, config, clock, sleeper).run();

        // then
        assertThat(summary.successful()).containsExactly(0, 3);
        assertThat(summary.failed()).containsExactly(1, 2);
        assertThat(summary.exitCode()).isEqualTo(1);
    }

    @Test
    void 실행_중_지나간_bucket은_건너뜀() {
        // given
        MutableClock clock = MutableClock.at(START, ZoneOffset.UTC);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        when(orchestrator.runFrom(anyInt(), any(), anyBoolean())).thenAnswer(invocation -> {
            if ((int) invocation.getArgument(0) == 20) {
                clock.advance(Duration.ofMinutes(150));
            }
            return OK;
        });

        // when
        ScheduleSummary summary = new TimeBucketScheduler(orchestrator, config, clock, sleeper).run();

        // then: 11:30에 끝남 → 10시, 11시 bucket 건너뜀 → 12시 bucket까지 30분 대기
        assertThat(summary.successful()).containsExactly(0, 3);
        assertThat(summary.skipped()).containsExactly(1, 2);
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofMinutes(30));
        verify(orchestrator, times(2)).runFrom(anyInt(), any(), anyBoolean());
    }

    @Test
    void 스케줄_중간에_시작하면_현재_bucket부터_즉시_실행() {
        // given
        MutableClock clock = MutableClock.at(START.plusMinutes(75), ZoneOffset.UTC);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        when(orchestrator.runFrom(anyInt(), any(), anyBoolean())).thenReturn(OK);

        // when
        ScheduleSummary summary = new TimeBucketScheduler(orchestrator, config, clock, sleeper).run();

        // then
        assertThat(summary.skipped()).containsExactly(0);
        assertThat(summary.successful()).containsExactly(1, 2, 3);
        assertThat(sleeper.getSleeps().get(0)).isEqualTo(Duration.ofMinutes(45));
        verify(orchestrator, never()).runFrom(eq(20), any(), anyBoolean());
    }

    @Test
    void 종료_시각이_지났으면_nothing_to_do() {
        // given
        MutableClock clock = MutableClock.at(END.plusMinutes(1), ZoneOffset.UTC);

        // when
        ScheduleSummary summary = new TimeBucketScheduler(orchestrator, config, clock, new RecordingSleeper()).run();

        // then
        assertThat(summary.nothingToDo()).isTrue();
        assertThat(summary.exitCode()).isZero();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void force_플래그_전달() {
        // given
        MutableClock clock = MutableClock.at(END, ZoneOffset.UTC);
        when(orchestrator.runFrom(anyInt(), any(), anyBoolean())).thenReturn(OK);

        // when
        new TimeBucketScheduler(orchestrator, config.withForce(true), clock, new RecordingSleeper()).run();

        // then: 12:00 정각은 마지막 bucket
        verify(orchestrator).runFrom(50, OptionalInt.of(10), true);
    }

    @Test
    void 설정_검증() {
        assertThatThrownBy(() -> new SchedulerConfig(START, START, Duration.ofHours(1), 0, 10, false))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("end-time must be after start-time");
        assertThatThrownBy(() -> new SchedulerConfig(START, END, Duration.ZERO, 0, 10, false))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new SchedulerConfig(START, END, Duration.ofHours(1), 0, 0, false))
            .isInstanceOf(ConfigurationException.class);
        assertThat(config.batchStartFor(3)).isEqualTo(50);
    }

    @Test
    void formatDuration_단위() {
        assertThat(TimeBucketScheduler.formatDuration(Duration.ofSeconds(45))).isEqualTo("45 seconds");
        assertThat(TimeBucketScheduler.formatDuration(Duration.ofSeconds(150))).isEqualTo("2.5 minutes");
        assertThat(TimeBucketScheduler.formatDuration(Duration.ofMinutes(75))).isEqualTo("1.25 hours");
    }
}
