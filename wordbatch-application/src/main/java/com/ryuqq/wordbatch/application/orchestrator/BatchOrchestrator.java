package com.ryuqq.wordbatch.application.orchestrator;

import java.util.OptionalInt;

/**
 * Sequential batch driver.
 *
 * <p>Iterates batch indices from a starting point and hands each partition to a
 * {@link com.ryuqq.wordbatch.application.runtime.PartitionRunner}. The run is fail-fast:
 * the first partition that ends in FAILED stops the loop, and the summary carries the
 * command that resumes from that partition.</p>
 *
 * <p><strong>Run Flow:</strong></p>
 * <pre>
 * runFrom(start, count, force)
 *   ↓
 * for index in [start, min(total, start + count)):
 *   1. compute partition (PartitionCalculator)
 *   2. empty partition → skipped, continue
 *   3. runPartition(partition, force)
 *        - true  → processed
 *        - false → failed, stop, emit resume command
 *   4. pause before next partition
 * </pre>
 *
 * <p>Indices beyond the last batch are never visited, so a count that overshoots the
 * total simply ends the run early.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface BatchOrchestrator {

    /**
     * Runs batches starting at {@code startBatch}.
     *
     * @param startBatch zero-based index of the first batch
     * @param count number of batches to visit; empty means "until the last batch"
     * @param force when true, existing valid output does not short-circuit a batch
     * @return summary of processed, skipped and failed batches
     * @throws IllegalArgumentException if startBatch is negative or count is not positive
     */
    BatchRunSummary runFrom(int startBatch, OptionalInt count, boolean force);
}
