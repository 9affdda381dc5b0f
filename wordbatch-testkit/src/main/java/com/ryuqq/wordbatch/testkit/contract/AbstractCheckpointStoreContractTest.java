package com.ryuqq.wordbatch.testkit.contract;

import com.ryuqq.wordbatch.core.model.CheckpointRecord;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract contract test for {@link CheckpointStore} implementations.
 *
 * <p>Every implementation must pass these scenarios:</p>
 * <ul>
 *   <li>Missing storage loads as an empty record</li>
 *   <li>Each mutation is persisted before returning (visible to a reopened store)</li>
 *   <li>markProcessed is idempotent and lastIndex tracks the latest call</li>
 *   <li>unprocessedIndices is position based: [processedCount, total)</li>
 *   <li>reset clears both memory and storage</li>
 *   <li>Concurrent markProcessed calls lose no key</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class FileCheckpointStoreContractTest extends AbstractCheckpointStoreContractTest {
 *     {@literal @}TempDir Path dir;
 *
 *     {@literal @}Override
 *     protected CheckpointStore openStore() {
 *         return new FileCheckpointStore(dir.resolve("checkpoint.json"), mapper);
 *     }
 * }
 * </pre>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public abstract class AbstractCheckpointStoreContractTest {

    protected CheckpointStore store;

    /**
     * 같은 저장 위치를 가리키는 새 store 인스턴스를 엽니다.
     *
     * <p>한 테스트 안에서 여러 번 호출될 수 있으며, 모든 인스턴스는 같은 저장 위치를 공유해야 합니다.</p>
     *
     * @return 새 store 인스턴스
     */
    protected abstract CheckpointStore openStore();

    @BeforeEach
    void setUpStore() {
        store = openStore();
    }

    @Test
    void 저장소가_없으면_빈_기록() {
        CheckpointRecord record = store.load();

        assertThat(record.processedCount()).isZero();
        assertThat(record.failedCount()).isZero();
        assertThat(record.getLastIndex()).isZero();
    }

    @Test
    void 변경은_반환_전에_저장된다() {
        // given
        store.markProcessed("apple", 0);
        store.markProcessed("banana", 1);
        store.markFailed("cherry");

        // when
        CheckpointStore reopened = openStore();

        // then
        assertThat(reopened.isProcessed("apple")).isTrue();
        assertThat(reopened.isProcessed("banana")).isTrue();
        assertThat(reopened.failedKeys()).containsExactly("cherry");
        assertThat(reopened.load().getLastIndex()).isEqualTo(1);
    }

    @Test
    void load가_돌려준_기록을_수정해도_저장소는_그대로() {
        // given
        store.markProcessed("apple", 0);
        CheckpointRecord snapshot = store.load();

        // when
        snapshot.markProcessed("banana", 1);
        snapshot.markFailed("cherry");

        // then
        assertThat(store.isProcessed("banana")).isFalse();
        assertThat(store.failedCount()).isZero();
        assertThat(openStore().isProcessed("banana")).isFalse();
    }

    @Test
    void markProcessed는_멱등이고_lastIndex는_마지막_값() {
        store.markProcessed("apple", 0);
        store.markProcessed("apple", 5);

        assertThat(store.processedCount()).isEqualTo(1);
        assertThat(store.load().getLastIndex()).isEqualTo(5);
    }

    @Test
    void unprocessedIndices는_위치_기반() {
        // given
        store.markProcessed("a", 0);
        store.markProcessed("b", 1);

        // when
        List<Integer> indices = store.unprocessedIndices(5);

        // then
        assertThat(indices).containsExactly(2, 3, 4);
        assertThat(store.unprocessedIndices(2)).isEmpty();
    }

    @Test
    void clearFailed는_processed를_건드리지_않는다() {
        store.markFailed("x");
        store.markProcessed("x", 0);

        store.clearFailed();

        assertThat(openStore().failedCount()).isZero();
        assertThat(openStore().isProcessed("x")).isTrue();
    }

    @Test
    void reset은_메모리와_저장소를_모두_비운다() {
        // given
        store.markProcessed("apple", 0);

        // when
        store.reset();

        // then
        assertThat(store.processedCount()).isZero();
        assertThat(openStore().processedCount()).isZero();
    }

    @Test
    void 동시_markProcessed에서_key가_유실되지_않는다() throws Exception {
        // given
        int workers = 4;
        int perWorker = 25;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when
        try {
            for (int w = 0; w < workers; w++) {
                int worker = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWorker; i++) {
                        store.markProcessed("w" + worker + "-" + i, worker * perWorker + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // then
        assertThat(store.processedCount()).isEqualTo(workers * perWorker);
        assertThat(openStore().processedCount()).isEqualTo(workers * perWorker);
    }
}
