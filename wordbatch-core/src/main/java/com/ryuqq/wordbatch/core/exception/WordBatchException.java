package com.ryuqq.wordbatch.core.exception;

/**
 * WordBatch 예외 계층의 최상위 타입.
 *
 * <p>모든 예외는 unchecked이며, 호출자가 종류별로 복구 여부를 결정합니다.</p>
 *
 * <pre>
 * WordBatchException
 *   ├─ TransientExternalFailureException  (재시도 대상)
 *   │    ├─ MalformedResponseException
 *   │    ├─ DictionaryLookupException
 *   │    │    └─ WordNotFoundException
 *   │    └─ GenerationException
 *   │         └─ GenerationTimeoutException
 *   ├─ SystemicFailureException           (연속 실패 임계값 초과)
 *   ├─ CorruptCheckpointException         (체크포인트 손상, reset 필요)
 *   ├─ CheckpointPersistenceException     (체크포인트 저장 실패)
 *   ├─ ConfigurationException             (잘못된 설정/인자)
 *   └─ WordBatchInterruptedException      (대기 중 인터럽트)
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class WordBatchException extends RuntimeException {

    public WordBatchException(String message) {
        super(message);
    }

    public WordBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
