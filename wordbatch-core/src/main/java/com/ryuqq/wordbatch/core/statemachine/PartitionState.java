package com.ryuqq.wordbatch.core.statemachine;

/**
 * 파티션 처리의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► SUCCESS (빈 구간 또는 기존 산출물 유효)
 *    │
 *    ▼ (시도 시작)
 * ATTEMPTING ◄──────┐
 *    │              │
 *    ├─► SUCCESS    │
 *    ├─► RETRY ─────┘ (남은 시도가 있음)
 *    └─► FAILED
 *
 * RETRY → FAILED (시도 소진)
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public enum PartitionState {

    /**
     * 아직 처리 시작 전.
     */
    PENDING,

    /**
     * 외부 단계 실행 중.
     */
    ATTEMPTING,

    /**
     * 이번 시도 실패, 다음 시도 대기 중.
     */
    RETRY,

    /**
     * 성공 (종료).
     */
    SUCCESS,

    /**
     * 실패 (종료).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
