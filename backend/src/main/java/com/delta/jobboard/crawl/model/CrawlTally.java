package com.delta.jobboard.crawl.model;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Counts and distinct errors of a set of job outcomes. Folding is commutative, so outcomes may be
 * added in any completion order.
 */
public record CrawlTally(int successCount, int failedCount, Set<String> errors) {

    public static final CrawlTally EMPTY = new CrawlTally(0, 0, Set.of());

    public CrawlTally {
        errors = Set.copyOf(errors == null ? Set.of() : errors);
    }

    public static CrawlTally of(Collection<JobOutcome> outcomes) {
        CrawlTally tally = EMPTY;
        if (outcomes == null) {
            return tally;
        }
        for (JobOutcome outcome : outcomes) {
            tally = tally.plus(outcome);
        }
        return tally;
    }

    public static CrawlTally carriedForward(CrawlStatusRecord previous) {
        if (previous == null) {
            return EMPTY;
        }
        return new CrawlTally(
            Math.max(0, previous.successCount()),
            Math.max(0, previous.failedCount()),
            Set.of()
        );
    }

    public CrawlTally plus(JobOutcome outcome) {
        if (outcome == null) {
            return this;
        }
        Set<String> merged = errors;
        if (!outcome.succeeded()) {
            merged = new TreeSet<>(errors);
            merged.add(outcome.error());
        }
        return new CrawlTally(
            successCount + outcome.successCount(),
            failedCount + outcome.failedCount(),
            merged
        );
    }

    public CrawlResult toResult(ErrorSet extraErrors, boolean orchestrationFailed, int maxErrorLogLength) {
        ErrorSet errorSet = new ErrorSet();
        errorSet.addAll(errors);
        if (extraErrors != null) {
            errorSet.addAll(extraErrors.values());
        }
        CrawlStatus status = orchestrationFailed || failedCount > 0 ? CrawlStatus.FAILED : CrawlStatus.SUCCESS;
        return new CrawlResult(status, successCount, failedCount, errorSet.format(maxErrorLogLength));
    }
}
