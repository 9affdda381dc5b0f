/**
 * 파티션 상태 머신 패키지.
 *
 * <p>{@link com.ryuqq.wordbatch.core.statemachine.PartitionState}와
 * {@link com.ryuqq.wordbatch.core.statemachine.StateTransition}으로
 * PENDING → ATTEMPTING → {SUCCESS, RETRY, FAILED} 흐름을 강제합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.core.statemachine;
