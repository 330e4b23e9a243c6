package com.pumpfun.indexer.modules.analytics.service;

import java.time.LocalDate;

/**
 * All attempts to compute a day's winner failed.
 */
public class DailyWinnerException extends RuntimeException {

    public DailyWinnerException(LocalDate day, Throwable cause) {
        super("Failed to get daily winner for day=" + day, cause);
    }
}
