package com.pumpfun.indexer.modules.indexer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counts for one committed range. Duplicates are records already present from an earlier,
 * uncheckpointed attempt at the same range.
 */
@Value
@Builder
public class BatchSummary {

    BlockRange range;
    int tokensCreated;
    int buys;
    int sells;
    int duplicatesSkipped;

    public int trades() {
        return buys + sells;
    }
}
