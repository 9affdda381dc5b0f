package com.ryuqq.wordbatch.application.runtime;

import com.ryuqq.wordbatch.core.model.Partition;

/**
 * Drives one partition to a terminal state.
 *
 * <p><strong>Attempt Flow:</strong></p>
 * <pre>
 * PENDING
 *   ├─ no items or valid existing output (unless force) → SUCCESS
 *   └─ ATTEMPTING
 *        1. clear stale progress markers
 *        2. enrichment stage
 *        3. generation stage
 *        4. salvage artifacts (≥1 item) into the partition folder
 *        ├─ artifacts salvaged            → SUCCESS
 *        └─ stage failure / no artifacts  → RETRY → ATTEMPTING ... → FAILED
 * </pre>
 *
 * <p>Stage failures never escape as exceptions; they are converted into retries.
 * Only interrupts propagate.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface PartitionRunner {

    /**
     * Processes a partition with retries.
     *
     * @param partition partition to process
     * @param force skip the "existing valid output" short-circuit
     * @return true when the partition ends in SUCCESS
     * @throws com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException when interrupted while waiting
     */
    boolean runPartition(Partition partition, boolean force);
}
