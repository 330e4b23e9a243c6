package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.config.IndexerProperties;
import com.pumpfun.indexer.modules.indexer.model.IterationResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link IndexingLoop}: one iteration at a time on a dedicated thread, the next one
 * scheduled only after the previous one returned, with the delay it asked for.
 * Stops for good on a halted iteration and publishes {@link IndexerHaltedEvent}.
 */
@Component
public class IndexerRunner {

    private static final Logger logger = LoggerFactory.getLogger(IndexerRunner.class);

    private final IndexingLoop indexingLoop;
    private final IndexerProperties.Indexer settings;
    private final ApplicationEventPublisher eventPublisher;
    private final ScheduledExecutorService executor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private volatile boolean stopped;
    private volatile IterationResult lastResult;

    @Autowired
    public IndexerRunner(IndexingLoop indexingLoop,
                         IndexerProperties properties,
                         ApplicationEventPublisher eventPublisher) {
        this(indexingLoop, properties, eventPublisher, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "indexer-loop");
            thread.setDaemon(true);
            return thread;
        }));
    }

    IndexerRunner(IndexingLoop indexingLoop,
                  IndexerProperties properties,
                  ApplicationEventPublisher eventPublisher,
                  ScheduledExecutorService executor) {
        this.indexingLoop = indexingLoop;
        this.settings = properties.getIndexer();
        this.eventPublisher = eventPublisher;
        this.executor = executor;
    }

    /**
     * Start indexing after application startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!settings.isEnabled()) {
            logger.info("Indexing loop is disabled (pumpfun.indexer.enabled=false)");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        logger.info("Starting indexing loop: blocksRange={}, stallDelayMs={}, errorDelayMs={}",
                settings.getBlocksRange(), settings.getStallDelayMs(), settings.getErrorDelayMs());
        executor.schedule(this::tick, 0, TimeUnit.MILLISECONDS);
    }

    /**
     * Run one iteration and schedule the next unless halted or stopped.
     */
    void tick() {
        if (stopped) {
            return;
        }
        IterationResult result = indexingLoop.runIteration();
        lastResult = result;

        if (result.isHalted()) {
            halted.set(true);
            logger.error("Indexing loop halted at checkpoint={}", result.getCheckpoint());
            eventPublisher.publishEvent(new IndexerHaltedEvent(this, result));
            return;
        }
        if (!stopped) {
            executor.schedule(this::tick, result.getNextDelayMs(), TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        executor.shutdownNow();
        logger.info("Indexing loop stopped");
    }

    public Optional<IterationResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public boolean isHalted() {
        return halted.get();
    }

    public boolean isRunning() {
        return started.get() && !halted.get() && !stopped;
    }
}
