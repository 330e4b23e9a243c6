package com.pumpfun.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Indexer configuration loaded from {@code pumpfun.*} in application.yaml.
 *
 * <p>{@code rpcUrl}, {@code contractAddress} and {@code initialBlockNumber} are mandatory;
 * {@link #validate()} is invoked once during bootstrap before any indexing starts.
 */
@Component
@ConfigurationProperties(prefix = "pumpfun")
public class IndexerProperties {

    /**
     * Ledger JSON-RPC endpoint.
     */
    private String rpcUrl;

    /**
     * Token factory contract address.
     */
    private String contractAddress;

    /**
     * Block height the checkpoint is seeded with when no checkpoint row exists.
     */
    private Long initialBlockNumber;

    /**
     * User accounts that must exist before the first run.
     */
    private List<String> bootstrapUsers = new ArrayList<>();

    private Indexer indexer = new Indexer();

    private DailyWinner dailyWinner = new DailyWinner();

    /**
     * Validate mandatory startup values.
     */
    public void validate() {
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("[pumpfun.rpc-url] is missing but required");
        }
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new IllegalStateException("[pumpfun.contract-address] is missing but required");
        }
        if (initialBlockNumber == null || initialBlockNumber <= 0) {
            throw new IllegalStateException("[pumpfun.initial-block-number] is missing but required");
        }
        if (indexer.getBlocksRange() < 2) {
            throw new IllegalStateException("[pumpfun.indexer.blocks-range] must be at least 2");
        }
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public Long getInitialBlockNumber() {
        return initialBlockNumber;
    }

    public void setInitialBlockNumber(Long initialBlockNumber) {
        this.initialBlockNumber = initialBlockNumber;
    }

    public List<String> getBootstrapUsers() {
        return bootstrapUsers;
    }

    public void setBootstrapUsers(List<String> bootstrapUsers) {
        this.bootstrapUsers = bootstrapUsers;
    }

    public Indexer getIndexer() {
        return indexer;
    }

    public void setIndexer(Indexer indexer) {
        this.indexer = indexer;
    }

    public DailyWinner getDailyWinner() {
        return dailyWinner;
    }

    public void setDailyWinner(DailyWinner dailyWinner) {
        this.dailyWinner = dailyWinner;
    }

    /**
     * Indexing loop tuning.
     */
    public static class Indexer {

        /**
         * Start the loop on application ready.
         */
        private boolean enabled = true;

        /**
         * Maximum number of blocks scanned per iteration.
         */
        private int blocksRange = 1000;

        /**
         * Delay after an iteration that found no new range.
         */
        private long stallDelayMs = 5_000;

        /**
         * Delay after a failed iteration.
         */
        private long errorDelayMs = 30_000;

        /**
         * Close the application when the loop halts on a fatal error.
         */
        private boolean exitOnFatal = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBlocksRange() {
            return blocksRange;
        }

        public void setBlocksRange(int blocksRange) {
            this.blocksRange = blocksRange;
        }

        public long getStallDelayMs() {
            return stallDelayMs;
        }

        public void setStallDelayMs(long stallDelayMs) {
            this.stallDelayMs = stallDelayMs;
        }

        public long getErrorDelayMs() {
            return errorDelayMs;
        }

        public void setErrorDelayMs(long errorDelayMs) {
            this.errorDelayMs = errorDelayMs;
        }

        public boolean isExitOnFatal() {
            return exitOnFatal;
        }

        public void setExitOnFatal(boolean exitOnFatal) {
            this.exitOnFatal = exitOnFatal;
        }
    }

    /**
     * Daily winner job settings.
     */
    public static class DailyWinner {

        private int maxAttempts = 3;

        private long retryDelayMs = 1_000;

        /**
         * Page size used when walking the token catalog.
         */
        private int tokenPageSize = 1000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public int getTokenPageSize() {
            return tokenPageSize;
        }

        public void setTokenPageSize(int tokenPageSize) {
            this.tokenPageSize = tokenPageSize;
        }
    }
}
