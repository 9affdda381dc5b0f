package com.ryuqq.wordbatch.core.partition;

import com.ryuqq.wordbatch.core.model.PartitionMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartitionConfigTest {

    @Test
    void defaults() {
        PartitionConfig config = new PartitionConfig();

        assertThat(config.mode()).isEqualTo(PartitionMode.FREQUENCY);
        assertThat(config.batchSize()).isEqualTo(100);
        assertThat(config.maxFrequency()).isEqualTo(20000);
    }

    @Test
    void withMethods_ReturnModifiedCopies() {
        PartitionConfig config = new PartitionConfig().withBatchSize(50).withMaxFrequency(1000);

        assertThat(config.batchSize()).isEqualTo(50);
        assertThat(config.maxFrequency()).isEqualTo(1000);
        assertThat(config.mode()).isEqualTo(PartitionMode.FREQUENCY);
    }

    @Test
    void invalidValues_Throw() {
        assertThatThrownBy(() -> new PartitionConfig(null, 100, 100))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionConfig().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize");
    }
}
