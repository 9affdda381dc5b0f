package com.ryuqq.wordbatch.testkit.time;

import com.ryuqq.wordbatch.core.time.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 실제로 잠들지 않고 요청된 대기 시간만 기록하는 Sleeper.
 *
 * <p>{@link MutableClock}과 함께 쓰면 대기한 만큼 시계를 앞으로 돌립니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null && !duration.isNegative()) {
            clock.advance(duration);
        }
    }

    public synchronized List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized Duration total() {
        Duration total = Duration.ZERO;
        for (Duration sleep : sleeps) {
            total = total.plus(sleep);
        }
        return total;
    }
}
