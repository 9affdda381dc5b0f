package com.ryuqq.wordbatch.core.spi;

import com.ryuqq.wordbatch.core.model.CheckpointRecord;

import java.util.List;

/**
 * 파이프라인 단계 하나의 진행 기록 저장소 SPI.
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>저장소가 없으면 첫 접근 시 빈 기록 생성</li>
 *   <li>프로세스당 한 번 로드 후 메모리에 캐시</li>
 *   <li>모든 변경(markProcessed, markFailed, clearFailed)은 반환 전에 즉시 저장
 *       (변경 단위로 크래시 안전)</li>
 *   <li>reset()은 메모리와 저장소 양쪽을 모두 지움</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다. 보강 단계의 동시 작업자들이
 * 같은 저장소에 markProcessed를 호출합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface CheckpointStore {

    /**
     * 기록 로드 (멱등, 첫 호출 이후 캐시).
     *
     * <p>반환값은 캐시의 스냅샷입니다. 수정해도 저장소에는 반영되지 않으며, 변경은
     * markProcessed, markFailed 등 저장소 메서드로만 합니다.</p>
     *
     * @return 캐시된 기록의 복사본
     * @throws com.ryuqq.wordbatch.core.exception.CorruptCheckpointException 저장소가 손상된 경우
     */
    CheckpointRecord load();

    /**
     * 캐시된 기록을 저장. 아직 로드되지 않았으면 아무것도 하지 않음.
     */
    void save();

    /**
     * key를 완료로 기록하고 저장.
     *
     * @param key 완료된 key (보통 단어)
     * @param index 순번 (lastIndex로 기록됨)
     */
    void markProcessed(String key, int index);

    /**
     * key를 실패로 기록하고 저장.
     *
     * @param key 실패한 key
     */
    void markFailed(String key);

    boolean isProcessed(String key);

    /**
     * 재개 시 처리할 순번 목록.
     *
     * <p><strong>주의:</strong> 내용 기반 차집합이 아니라 위치 기반 커서입니다.
     * processed 개수를 P라고 하면 [P, totalCount) 를 반환합니다. 항목 순서가 실행 간에
     * 바뀌지 않는다는 전제에서만 올바릅니다.</p>
     *
     * @param totalCount 전체 항목 수
     * @return [processedCount, totalCount) 순번 목록
     */
    List<Integer> unprocessedIndices(int totalCount);

    /**
     * 실패 key 목록 복사본.
     *
     * @return failed 목록
     */
    List<String> failedKeys();

    /**
     * 실패 목록 비우고 저장.
     */
    void clearFailed();

    int processedCount();

    int failedCount();

    /**
     * 기록 초기화 (메모리 캐시와 저장소 삭제).
     */
    void reset();
}
