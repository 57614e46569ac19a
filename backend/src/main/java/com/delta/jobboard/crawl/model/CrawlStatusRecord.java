package com.delta.jobboard.crawl.model;

import java.time.Instant;

public record CrawlStatusRecord(
    long companyRowId,
    String outputTable,
    CrawlStatus status,
    int successCount,
    int failedCount,
    String errorLog,
    Instant startedAt,
    Instant finishedAt
) {
}
