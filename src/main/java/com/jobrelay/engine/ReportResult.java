package com.jobrelay.engine;

public enum ReportResult {
    ACKNOWLEDGED,
    /**
     * The reporter no longer holds the lease. Nothing was written.
     */
    REJECTED
}
