package com.pumpfun.indexer.modules.chains.ledger;

import org.web3j.protocol.core.methods.response.Log;

import java.util.List;

/**
 * Read-only gateway to the chain. Every method may throw {@link LedgerException}.
 */
public interface LedgerSource {

    /**
     * Current chain tip.
     */
    long getChainHeight();

    /**
     * Factory contract logs with the given topic in the inclusive range {@code [fromBlock, toBlock]},
     * ordered by block number then log index.
     */
    List<Log> getLogs(long fromBlock, long toBlock, String eventTopic);

    /**
     * Sender address of a transaction.
     */
    String getTransactionSender(String txnHash);

    /**
     * Calls a no-argument view method returning a string, e.g. {@code name()} or {@code symbol()}.
     */
    String callStringMethod(String contractAddress, String methodName);
}
