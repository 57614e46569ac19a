package com.delta.jobboard.crawl.model;

public record MissingDescriptionJob(long jobId, String url) {
}
