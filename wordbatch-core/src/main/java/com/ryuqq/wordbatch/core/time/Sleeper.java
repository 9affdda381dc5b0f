package com.ryuqq.wordbatch.core.time;

import com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException;

import java.time.Duration;

/**
 * 대기(sleep) 추상화.
 *
 * <p>재시도 backoff, 배치 간 휴식, 스케줄 트리거 대기처럼 모든 대기 지점은
 * 이 인터페이스를 통과합니다. 테스트에서는 실제로 잠들지 않는 구현을 주입합니다.</p>
 *
 * <p>인터럽트 발생 시 구현체는 인터럽트 플래그를 복원하고
 * {@link WordBatchInterruptedException}을 던져야 합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간만큼 대기.
     *
     * @param duration 대기 시간 (0 이하면 즉시 반환)
     * @throws WordBatchInterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration);

    /**
     * Thread.sleep 기반 기본 구현.
     *
     * @return 실제로 잠드는 Sleeper
     */
    static Sleeper system() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WordBatchInterruptedException("Sleep interrupted", e);
            }
        };
    }
}
