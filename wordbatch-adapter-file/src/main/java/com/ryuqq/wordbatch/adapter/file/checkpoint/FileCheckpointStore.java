package com.ryuqq.wordbatch.adapter.file.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.adapter.file.json.AtomicFiles;
import com.ryuqq.wordbatch.core.exception.CheckpointPersistenceException;
import com.ryuqq.wordbatch.core.exception.CorruptCheckpointException;
import com.ryuqq.wordbatch.core.model.CheckpointRecord;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * JSON 파일 기반 {@link CheckpointStore}.
 *
 * <p><strong>파일 형식:</strong></p>
 * <pre>
 * {
 *   "processed_words" : [ "apple", "banana" ],
 *   "failed_words" : [ "qwzx" ],
 *   "last_index" : 1
 * }
 * </pre>
 *
 * <p><strong>잠금:</strong></p>
 * <ul>
 *   <li>프로세스 간: 형제 파일 {@code <name>.lock} 에 대한 {@link FileChannel#lock()}.
 *       load 또는 save 한 번 동안만 보유</li>
 *   <li>JVM 내부: 경로별 monitor. 같은 JVM의 두 스레드가 같은 파일을 잠그면
 *       OverlappingFileLockException이 나므로 파일 잠금 앞에서 직렬화</li>
 * </ul>
 *
 * <p>저장은 임시 파일에 쓴 뒤 원자적으로 이름을 바꿉니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private static final ConcurrentMap<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path location;
    private final Path lockFile;
    private final ObjectMapper mapper;
    private final Object monitor;
    private CheckpointRecord cached;

    /**
     * 생성자.
     *
     * @param location 체크포인트 JSON 파일 경로
     * @param mapper JSON 매퍼
     */
    public FileCheckpointStore(Path location, ObjectMapper mapper) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.location = location.toAbsolutePath().normalize();
        this.lockFile = lockFileFor(this.location);
        this.mapper = mapper;
        this.monitor = MONITORS.computeIfAbsent(this.location, key -> new Object());
    }

    static Path lockFileFor(Path location) {
        String name = location.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return location.resolveSibling(base + ".lock");
    }

    @Override
    public CheckpointRecord load() {
        synchronized (monitor) {
            return record().copy();
        }
    }

    // caller holds monitor
    private CheckpointRecord record() {
        if (cached == null) {
            cached = read();
        }
        return cached;
    }

    @Override
    public void save() {
        synchronized (monitor) {
            if (cached == null) {
                return;
            }
            write(cached);
        }
    }

    @Override
    public void markProcessed(String key, int index) {
        synchronized (monitor) {
            record().markProcessed(key, index);
            write(cached);
        }
    }

    @Override
    public void markFailed(String key) {
        synchronized (monitor) {
            record().markFailed(key);
            write(cached);
        }
    }

    @Override
    public boolean isProcessed(String key) {
        synchronized (monitor) {
            return record().isProcessed(key);
        }
    }

    @Override
    public List<Integer> unprocessedIndices(int totalCount) {
        int processed;
        synchronized (monitor) {
            processed = record().processedCount();
        }
        List<Integer> indices = new ArrayList<>();
        for (int i = processed; i < totalCount; i++) {
            indices.add(i);
        }
        return indices;
    }

    @Override
    public List<String> failedKeys() {
        synchronized (monitor) {
            return record().getFailed();
        }
    }

    @Override
    public void clearFailed() {
        synchronized (monitor) {
            record().clearFailed();
            write(cached);
        }
    }

    @Override
    public int processedCount() {
        synchronized (monitor) {
            return record().processedCount();
        }
    }

    @Override
    public int failedCount() {
        synchronized (monitor) {
            return record().failedCount();
        }
    }

    @Override
    public void reset() {
        synchronized (monitor) {
            cached = null;
            withFileLock(() -> {
                Files.deleteIfExists(location);
                return null;
            });
            log.debug("Checkpoint reset: {}", location);
        }
    }

    public Path getLocation() {
        return location;
    }

    private CheckpointRecord read() {
        return withFileLock(() -> {
            if (!Files.exists(location)) {
                return new CheckpointRecord();
            }
            try {
                CheckpointRecord record = mapper.readValue(location.toFile(), CheckpointRecord.class);
                if (record == null) {
                    throw new CorruptCheckpointException(location.toString(), null);
                }
                log.debug("Checkpoint loaded: {} ({})", location, record);
                return record;
            } catch (IOException e) {
                throw new CorruptCheckpointException(location.toString(), e);
            }
        });
    }

    private void write(CheckpointRecord record) {
        withFileLock(() -> {
            AtomicFiles.write(location, mapper.writeValueAsBytes(record));
            return null;
        });
    }

    private <T> T withFileLock(IoAction<T> action) {
        try {
            Files.createDirectories(location.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } catch (IOException e) {
            throw new CheckpointPersistenceException("Checkpoint I/O failed: " + location, e);
        }
    }

    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
}
