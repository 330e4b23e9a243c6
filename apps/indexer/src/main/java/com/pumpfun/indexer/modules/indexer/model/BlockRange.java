package com.pumpfun.indexer.modules.indexer.model;

import lombok.Value;

import java.util.Optional;

/**
 * Inclusive block span scanned in one iteration.
 */
@Value
public class BlockRange {

    long fromBlock;
    long toBlock;

    /**
     * Next range after {@code checkpoint}, capped at {@code maxBlocks} and clamped to the chain tip.
     * Empty when fewer than two new blocks are available.
     */
    public static Optional<BlockRange> next(long checkpoint, long chainTip, int maxBlocks) {
        long from = checkpoint + 1;
        long to = Math.min(from + maxBlocks - 1, chainTip);
        if (to - from < 1) {
            return Optional.empty();
        }
        return Optional.of(new BlockRange(from, to));
    }

    public long size() {
        return toBlock - fromBlock + 1;
    }

    @Override
    public String toString() {
        return "[" + fromBlock + "-" + toBlock + "]";
    }
}
