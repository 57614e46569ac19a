package com.delta.jobboard.crawl.model;

public record ListingFields(
    String title,
    String url,
    String location,
    String postDate
) {
}
