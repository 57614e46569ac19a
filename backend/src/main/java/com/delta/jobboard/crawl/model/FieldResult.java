package com.delta.jobboard.crawl.model;

/**
 * Value of one extracted listing field. When the field could not be read the default is carried
 * together with the reason, so callers can tell an extracted value from a fallback.
 */
public record FieldResult<T>(T value, boolean defaulted, String reason) {

    public static <T> FieldResult<T> extracted(T value) {
        return new FieldResult<>(value, false, null);
    }

    public static <T> FieldResult<T> fallback(T defaultValue, String reason) {
        return new FieldResult<>(defaultValue, true, reason);
    }
}
