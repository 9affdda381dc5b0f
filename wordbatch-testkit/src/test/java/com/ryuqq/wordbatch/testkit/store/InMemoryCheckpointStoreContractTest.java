package com.ryuqq.wordbatch.testkit.store;

import com.ryuqq.wordbatch.core.model.CheckpointRecord;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import com.ryuqq.wordbatch.testkit.contract.AbstractCheckpointStoreContractTest;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryCheckpointStore 계약 테스트.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class InMemoryCheckpointStoreContractTest extends AbstractCheckpointStoreContractTest {

    private final Map<String, CheckpointRecord> storage = new ConcurrentHashMap<>();

    @Override
    protected CheckpointStore openStore() {
        return new InMemoryCheckpointStore(storage, "step2");
    }

    @Test
    void save_전에_load하지_않으면_아무것도_저장하지_않는다() {
        InMemoryCheckpointStore fresh = new InMemoryCheckpointStore(storage, "untouched");

        fresh.save();

        assertThat(fresh.isPersisted()).isFalse();
        assertThat(fresh.getSaveCount()).isZero();
    }
}
