package com.delta.jobboard.crawl.jobs;

public class ListingExtractionException extends RuntimeException {
    public ListingExtractionException(String message) {
        super(message);
    }
}
