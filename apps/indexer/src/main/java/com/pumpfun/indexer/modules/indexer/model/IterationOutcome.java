package com.pumpfun.indexer.modules.indexer.model;

/**
 * How one pass of the indexing loop ended.
 */
public enum IterationOutcome {
    /** Range persisted and checkpoint advanced. */
    ADVANCED,
    /** Not enough new blocks; checkpoint unchanged. */
    STALLED,
    /** Retryable failure; checkpoint unchanged, same range is scanned again. */
    RETRY,
    /** Fatal failure; the driver must stop scheduling. */
    HALTED
}
