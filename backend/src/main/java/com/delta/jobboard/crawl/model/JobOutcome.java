package com.delta.jobboard.crawl.model;

/**
 * Result of processing one listing node. Exactly one of the two counts is 1.
 */
public record JobOutcome(boolean succeeded, String error) {

    public static JobOutcome success() {
        return new JobOutcome(true, null);
    }

    public static JobOutcome failure(String error) {
        return new JobOutcome(false, error == null || error.isBlank() ? "unknown_error" : error);
    }

    public int successCount() {
        return succeeded ? 1 : 0;
    }

    public int failedCount() {
        return succeeded ? 0 : 1;
    }
}
