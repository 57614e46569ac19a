package com.delta.jobboard.crawl.model;

public record PersistResult(boolean ok, String errorMessage) {

    public static PersistResult success() {
        return new PersistResult(true, null);
    }

    public static PersistResult failure(String errorMessage) {
        return new PersistResult(false, errorMessage);
    }
}
