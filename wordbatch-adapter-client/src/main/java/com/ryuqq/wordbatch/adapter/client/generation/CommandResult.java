package com.ryuqq.wordbatch.adapter.client.generation;

/**
 * 외부 명령 실행 결과.
 *
 * @param exitCode 종료 코드
 * @param stdout 표준 출력
 * @param stderr 표준 오류
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
