package com.ryuqq.wordbatch.core.schedule;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 고정 간격 실행 시각 목록 (time bucket).
 *
 * <p>startTime부터 interval 간격으로 endTime 이하인 시각을 모두 나열합니다.
 * 상한은 포함이므로 마지막 bucket이 endTime과 같을 수 있습니다.</p>
 *
 * <pre>
 * start=09:00, end=12:00, interval=1h
 *   → [09:00, 10:00, 11:00, 12:00]
 * currentBucket(08:30) = 0   (첫 트리거 전, 대기)
 * currentBucket(11:30) = 2   (11:00 bucket)
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class RunSchedule {

    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final Duration interval;
    private final List<LocalDateTime> runTimes;

    private RunSchedule(LocalDateTime startTime, LocalDateTime endTime, Duration interval) {
        this.startTime = startTime;
        this.endTime = endTime;
        this.interval = interval;
        this.runTimes = calculateRunTimes(startTime, endTime, interval);
    }

    /**
     * 실행 시각 목록 생성.
     *
     * @param startTime 첫 실행 시각
     * @param endTime 이 시각 이후로는 새 실행을 시작하지 않음 (포함)
     * @param interval 실행 간격 (양수)
     * @return RunSchedule
     * @throws IllegalArgumentException 인자가 null이거나 interval이 양수가 아닌 경우
     */
    public static RunSchedule of(LocalDateTime startTime, LocalDateTime endTime, Duration interval) {
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        return new RunSchedule(startTime, endTime, interval);
    }

    /**
     * 시간 단위 간격(소수 허용)을 Duration으로 변환.
     *
     * @param hours 간격 (시간, 예: 1.5)
     * @return 밀리초 정밀도의 Duration
     */
    public static Duration hours(double hours) {
        return Duration.ofMillis(Math.round(hours * 3_600_000d));
    }

    private static List<LocalDateTime> calculateRunTimes(LocalDateTime start, LocalDateTime end, Duration interval) {
        List<LocalDateTime> times = new ArrayList<>();
        LocalDateTime current = start;
        while (!current.isAfter(end)) {
            times.add(current);
            current = current.plus(interval);
        }
        return List.copyOf(times);
    }

    /**
     * 현재 시각이 속한 bucket 번호.
     *
     * <p>now가 첫 트리거보다 이르면 0을 반환합니다 (호출자가 대기).
     * 그 외에는 runTimes[i] ≤ now 를 만족하는 가장 큰 i를 반환합니다.</p>
     *
     * @param now 현재 시각
     * @return bucket 번호
     */
    public int currentBucket(LocalDateTime now) {
        if (runTimes.isEmpty() || now.isBefore(runTimes.get(0))) {
            return 0;
        }
        for (int i = runTimes.size() - 1; i >= 0; i--) {
            if (!now.isBefore(runTimes.get(i))) {
                return i;
            }
        }
        return 0;
    }

    /**
     * 모든 실행 시각이 이미 지났는지 확인 (now가 endTime 이후).
     *
     * @param now 현재 시각
     * @return now &gt; endTime
     */
    public boolean isOver(LocalDateTime now) {
        return now.isAfter(endTime);
    }

    public LocalDateTime runTime(int bucket) {
        return runTimes.get(bucket);
    }

    public List<LocalDateTime> getRunTimes() {
        return runTimes;
    }

    public int size() {
        return runTimes.size();
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public Duration getInterval() {
        return interval;
    }
}
