package com.pumpfun.indexer.modules.indexer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one indexing iteration, consumed by the driver to decide what happens next.
 */
@Value
@Builder
public class IterationResult {

    IterationOutcome outcome;

    /**
     * Checkpoint height after the iteration.
     */
    long checkpoint;

    /**
     * Delay before the next iteration; meaningless for {@link IterationOutcome#HALTED}.
     */
    long nextDelayMs;

    /**
     * Present for {@link IterationOutcome#ADVANCED}.
     */
    BatchSummary summary;

    /**
     * Present for {@link IterationOutcome#RETRY} and {@link IterationOutcome#HALTED}.
     */
    Throwable error;

    public boolean isHalted() {
        return outcome == IterationOutcome.HALTED;
    }
}
