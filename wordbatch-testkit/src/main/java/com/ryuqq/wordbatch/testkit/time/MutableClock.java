package com.ryuqq.wordbatch.testkit.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 테스트에서 직접 움직이는 시계.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant instant;

    public MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * 로컬 시각으로 시계 생성.
     *
     * @param localDateTime 시작 시각
     * @param zone 시간대
     * @return MutableClock
     */
    public static MutableClock at(LocalDateTime localDateTime, ZoneId zone) {
        return new MutableClock(localDateTime.atZone(zone).toInstant(), zone);
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    public void set(LocalDateTime localDateTime) {
        instant = localDateTime.atZone(zone).toInstant();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
