package com.pumpfun.indexer.modules.chains.ledger;

/**
 * Thrown when a ledger call fails (transport or JSON-RPC error). Always retryable.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
