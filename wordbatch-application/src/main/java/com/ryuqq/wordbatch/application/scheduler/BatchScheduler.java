package com.ryuqq.wordbatch.application.scheduler;

/**
 * 시간 bucket 기반 배치 스케줄러.
 *
 * <p>bucket i 의 트리거 시각이 되면 배치 구간
 * [startBatch + i * batchesPerBucket, + batchesPerBucket) 를 실행합니다.
 * 한 bucket의 실패는 로그만 남기고 다음 bucket으로 진행하며,
 * 실행 중에 이미 지나간 bucket은 건너뜁니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface BatchScheduler {

    /**
     * 남은 bucket을 모두 실행할 때까지 블록.
     *
     * @return 실행 요약
     */
    ScheduleSummary run();
}
