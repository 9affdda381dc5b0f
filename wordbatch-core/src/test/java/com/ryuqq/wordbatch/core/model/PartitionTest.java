package com.ryuqq.wordbatch.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PartitionTest {

    @Test
    void contains_FrequencyModeIsInclusive() {
        Partition partition = new Partition(1, PartitionMode.FREQUENCY, 101, 200, "101-200");

        assertThat(partition.contains(new VocabularyItem(0, 101, "a"))).isTrue();
        assertThat(partition.contains(new VocabularyItem(0, 200, "b"))).isTrue();
        assertThat(partition.contains(new VocabularyItem(0, 201, "c"))).isFalse();
    }

    @Test
    void contains_RowModeExcludesEnd() {
        Partition partition = new Partition(0, PartitionMode.ROW, 0, 100, "0-100");

        assertThat(partition.contains(new VocabularyItem(99, 1, "a"))).isTrue();
        assertThat(partition.contains(new VocabularyItem(100, 1, "b"))).isFalse();
    }
}
