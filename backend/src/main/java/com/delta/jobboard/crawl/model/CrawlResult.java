package com.delta.jobboard.crawl.model;

public record CrawlResult(
    CrawlStatus status,
    int successCount,
    int failedCount,
    String errorLog
) {
}
