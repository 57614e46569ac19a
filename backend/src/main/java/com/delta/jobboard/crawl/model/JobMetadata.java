package com.delta.jobboard.crawl.model;

public record JobMetadata(String category, String employmentType) {
    public static final JobMetadata EMPTY = new JobMetadata("", "");
}
