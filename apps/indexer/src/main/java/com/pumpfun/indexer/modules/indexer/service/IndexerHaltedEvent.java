package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.modules.indexer.model.IterationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published once when the indexing loop stops on a fatal error.
 */
public class IndexerHaltedEvent extends ApplicationEvent {

    private final transient IterationResult result;

    public IndexerHaltedEvent(Object source, IterationResult result) {
        super(source);
        this.result = result;
    }

    public IterationResult getResult() {
        return result;
    }
}
