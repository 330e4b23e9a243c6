package com.pumpfun.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PumpFun Indexer Application
 * Token factory event indexing and daily winner aggregation
 */
@SpringBootApplication
@EnableScheduling
public class PumpFunIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(PumpFunIndexerApplication.class);

    public static void main(String[] args) {
        logger.info("Starting PumpFun Indexer Application...");
        SpringApplication.run(PumpFunIndexerApplication.class, args);
        logger.info("PumpFun Indexer Application started successfully!");
    }
}
