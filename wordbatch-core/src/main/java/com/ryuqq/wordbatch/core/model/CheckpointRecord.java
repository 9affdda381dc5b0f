package com.ryuqq.wordbatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 파이프라인 단계 하나의 진행 상황 기록.
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>processed: 완료된 key (삽입 순서 유지, O(1) 포함 검사)</li>
 *   <li>failed: 실패한 key 이력</li>
 *   <li>lastIndex: 마지막으로 완료된 순번 커서</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>processed에 있는 key는 강제 재처리가 아닌 한 다시 제출되지 않음</li>
 *   <li>failed와 processed는 서로소가 아닐 수 있음. 실패 후 성공한 key는 processed에
 *       추가되지만 failed에서 제거되지 않음 ("완료" 판단은 항상 processed 기준)</li>
 * </ul>
 *
 * <p>이 클래스는 thread-safe하지 않습니다. 동시 접근은 CheckpointStore 구현체가 직렬화합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class CheckpointRecord {

    private final LinkedHashSet<String> processed;
    private final LinkedHashSet<String> failed;
    private int lastIndex;

    /**
     * 빈 기록 생성.
     */
    public CheckpointRecord() {
        this(List.of(), List.of(), 0);
    }

    /**
     * 저장된 값으로 기록 복원.
     *
     * @param processed 완료된 key 목록 (null이면 빈 목록)
     * @param failed 실패한 key 목록 (null이면 빈 목록)
     * @param lastIndex 마지막 순번
     */
    @JsonCreator
    public CheckpointRecord(
        @JsonProperty("processed_words") Collection<String> processed,
        @JsonProperty("failed_words") Collection<String> failed,
        @JsonProperty("last_index") int lastIndex
    ) {
        this.processed = processed == null ? new LinkedHashSet<>() : new LinkedHashSet<>(processed);
        this.failed = failed == null ? new LinkedHashSet<>() : new LinkedHashSet<>(failed);
        this.lastIndex = lastIndex;
    }

    /**
     * key를 완료로 기록.
     *
     * <p>이미 있는 key는 중복 추가되지 않으며, lastIndex는 항상 주어진 index로 갱신됩니다.</p>
     *
     * @param key 완료된 key
     * @param index 순번
     */
    public void markProcessed(String key, int index) {
        requireKey(key);
        processed.add(key);
        lastIndex = index;
    }

    /**
     * key를 실패로 기록.
     *
     * @param key 실패한 key
     */
    public void markFailed(String key) {
        requireKey(key);
        failed.add(key);
    }

    public void clearFailed() {
        failed.clear();
    }

    public boolean isProcessed(String key) {
        return processed.contains(key);
    }

    @JsonProperty("processed_words")
    public List<String> getProcessed() {
        return new ArrayList<>(processed);
    }

    @JsonProperty("failed_words")
    public List<String> getFailed() {
        return new ArrayList<>(failed);
    }

    @JsonProperty("last_index")
    public int getLastIndex() {
        return lastIndex;
    }

    public int processedCount() {
        return processed.size();
    }

    public int failedCount() {
        return failed.size();
    }

    /**
     * 깊은 복사본 생성.
     *
     * @return 같은 내용을 가진 새 CheckpointRecord
     */
    public CheckpointRecord copy() {
        return new CheckpointRecord(processed, failed, lastIndex);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    /**
     * 완료된 key 집합의 읽기 전용 뷰.
     *
     * @return processed 뷰
     */
    public Set<String> processedView() {
        return Collections.unmodifiableSet(processed);
    }

    @Override
    public String toString() {
        return "CheckpointRecord{processed=" + processed.size()
            + ", failed=" + failed.size()
            + ", lastIndex=" + lastIndex + '}';
    }
}
