package com.ryuqq.wordbatch.adapter.client.generation;

import java.time.Duration;
import java.util.List;

/**
 * 외부 명령 실행 추상화.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface CommandExecutor {

    /**
     * 명령을 실행하고 종료를 기다림.
     *
     * @param command 명령과 인자
     * @param timeout 최대 대기 시간
     * @return 실행 결과
     * @throws com.ryuqq.wordbatch.core.exception.GenerationTimeoutException 시간 초과 (프로세스는 종료됨)
     * @throws com.ryuqq.wordbatch.core.exception.GenerationException 실행 파일을 시작할 수 없는 경우
     */
    CommandResult execute(List<String> command, Duration timeout);
}
