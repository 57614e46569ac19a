package com.delta.jobboard.crawl.model;

public record JobRecord(
    String title,
    String url,
    String location,
    String postDate,
    String description,
    String category,
    String employmentType,
    String outputTable
) {
    public boolean isValid() {
        return title != null && !title.isBlank() && url != null && !url.isBlank();
    }
}
