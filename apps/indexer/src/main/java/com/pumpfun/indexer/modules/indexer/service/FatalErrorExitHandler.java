package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.config.IndexerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Terminates the process when the indexer halts, leaving restart and alerting to the
 * process supervisor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FatalErrorExitHandler {

    static final int EXIT_CODE = 1;

    private final ApplicationContext applicationContext;
    private final IndexerProperties properties;

    @EventListener
    public void onIndexerHalted(IndexerHaltedEvent event) {
        Throwable cause = event.getResult().getError();
        if (!properties.getIndexer().isExitOnFatal()) {
            log.warn("Indexer halted ({}); process kept alive (pumpfun.indexer.exit-on-fatal=false)",
                    cause != null ? cause.getMessage() : "unknown cause");
            return;
        }

        log.error("Indexer halted ({}), exit", cause != null ? cause.getMessage() : "unknown cause");
        // Off the indexer thread: closing the context shuts that thread's executor down
        new Thread(() -> {
            int code = SpringApplication.exit(applicationContext, () -> EXIT_CODE);
            System.exit(code);
        }, "indexer-fatal-exit").start();
    }
}
