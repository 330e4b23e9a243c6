package com.pumpfun.indexer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility with exponential backoff
 */
public final class RetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(RetryUtils.class);
    private static final long MAX_DELAY_MS = 60000;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private RetryUtils() {
    }

    /**
     * Execute a task up to {@code maxAttempts} times, sleeping between attempts.
     *
     * @param taskName       Name used in log lines
     * @param task           Task to execute
     * @param maxAttempts    Total number of attempts, at least 1
     * @param initialDelayMs Delay after the first failure; doubled after each further failure
     * @param <T>            Return type
     * @return Result from the first successful attempt
     * @throws InterruptedException If the task or the backoff sleep is interrupted; not retried
     * @throws Exception The last failure once all attempts are exhausted
     */
    public static <T> T executeWithRetry(String taskName,
                                         RetryableTask<T> task,
                                         int maxAttempts,
                                         long initialDelayMs) throws Exception {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        long delayMs = initialDelayMs;
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return task.execute();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                lastException = e;
                logger.error("Failed to {}, attempt: {}/{}", taskName, attempt, maxAttempts, e);
                if (attempt < maxAttempts && delayMs > 0) {
                    Thread.sleep(Math.min(delayMs, MAX_DELAY_MS));
                    delayMs = (long) (delayMs * BACKOFF_MULTIPLIER);
                }
            }
        }
        throw lastException;
    }

    /**
     * Functional interface for retryable task
     */
    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute() throws Exception;
    }
}
