package com.delta.jobboard.crawl.model;

/**
 * The company whose job board is crawled. {@code jobsUrl} is the raw listing URL as stored and may
 * still carry a feed suffix.
 */
public record CompanyContext(
    long companyRowId,
    String jobsUrl,
    String resourceName
) {
}
