package com.ryuqq.wordbatch.core.exception;

/**
 * 체크포인트 파일을 읽을 수 없거나 손상된 경우.
 *
 * <p>부분 복구는 지원하지 않습니다. 호출자가 reset() 여부를 결정해야 합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class CorruptCheckpointException extends WordBatchException {

    private final String location;

    public CorruptCheckpointException(String location, Throwable cause) {
        super("Checkpoint is unreadable or corrupt: " + location, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
