package com.ryuqq.wordbatch.testkit.store;

import com.ryuqq.wordbatch.core.model.CheckpointRecord;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CheckpointStore} for tests.
 *
 * <p>The "persisted" side is a map shared between instances, so a test can open a
 * second store over the same name and observe what the first one saved, the same way
 * two processes would see one checkpoint file.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>storage:</strong> name → last saved CheckpointRecord copy</li>
 *   <li><strong>cached:</strong> this instance's loaded record (null until first access)</li>
 * </ul>
 *
 * <p>All operations are synchronized on the instance.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, CheckpointRecord> storage;
    private final String name;
    private CheckpointRecord cached;
    private int saveCount;

    /**
     * 독립된 저장 공간을 가진 store 생성.
     */
    public InMemoryCheckpointStore() {
        this(new ConcurrentHashMap<>(), "checkpoint");
    }

    /**
     * 공유 저장 공간 위의 store 생성.
     *
     * @param storage 저장 공간 (여러 인스턴스가 공유 가능)
     * @param name 저장 key
     */
    public InMemoryCheckpointStore(Map<String, CheckpointRecord> storage, String name) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.storage = storage;
        this.name = name;
    }

    @Override
    public synchronized CheckpointRecord load() {
        return record().copy();
    }

    private CheckpointRecord record() {
        if (cached == null) {
            CheckpointRecord persisted = storage.get(name);
            cached = persisted == null ? new CheckpointRecord() : persisted.copy();
        }
        return cached;
    }

    @Override
    public synchronized void save() {
        if (cached == null) {
            return;
        }
        storage.put(name, cached.copy());
        saveCount++;
    }

    @Override
    public synchronized void markProcessed(String key, int index) {
        record().markProcessed(key, index);
        save();
    }

    @Override
    public synchronized void markFailed(String key) {
        record().markFailed(key);
        save();
    }

    @Override
    public synchronized boolean isProcessed(String key) {
        return record().isProcessed(key);
    }

    @Override
    public synchronized List<Integer> unprocessedIndices(int totalCount) {
        List<Integer> indices = new ArrayList<>();
        for (int i = record().processedCount(); i < totalCount; i++) {
            indices.add(i);
        }
        return indices;
    }

    @Override
    public synchronized List<String> failedKeys() {
        return record().getFailed();
    }

    @Override
    public synchronized void clearFailed() {
        record().clearFailed();
        save();
    }

    @Override
    public synchronized int processedCount() {
        return record().processedCount();
    }

    @Override
    public synchronized int failedCount() {
        return record().failedCount();
    }

    @Override
    public synchronized void reset() {
        cached = null;
        storage.remove(name);
    }

    /**
     * save() 호출 횟수 (테스트 검증용).
     *
     * @return 누적 저장 횟수
     */
    public synchronized int getSaveCount() {
        return saveCount;
    }

    /**
     * 저장 공간에 기록이 있는지 확인.
     *
     * @return 저장된 기록 존재 여부
     */
    public boolean isPersisted() {
        return storage.containsKey(name);
    }
}
