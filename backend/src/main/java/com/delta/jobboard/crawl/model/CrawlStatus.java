package com.delta.jobboard.crawl.model;

public enum CrawlStatus {
    SUCCESS,
    FAILED
}
