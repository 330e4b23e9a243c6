package com.pumpfun.indexer.modules.chains.events;

/**
 * A swap event references a token that is not in the store. Fatal for the whole batch:
 * dropping the trade would corrupt volume aggregates.
 */
public class UnknownTokenException extends RuntimeException {

    private final String tokenAddress;
    private final String txnHash;

    public UnknownTokenException(String tokenAddress, String txnHash) {
        super("Failed to get token by address=\"" + tokenAddress + "\", event tx hash=\"" + txnHash + "\"");
        this.tokenAddress = tokenAddress;
        this.txnHash = txnHash;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public String getTxnHash() {
        return txnHash;
    }
}
