package com.pumpfun.indexer.modules.indexer.service;

/**
 * The checkpoint could not be created or advanced. Forward progress can no longer be
 * recorded safely, so this is always fatal for the indexing loop.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
