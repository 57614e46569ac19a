package com.delta.jobboard.crawl.jobs;

public class ListingFetchException extends RuntimeException {
    public ListingFetchException(String message) {
        super(message);
    }
}
