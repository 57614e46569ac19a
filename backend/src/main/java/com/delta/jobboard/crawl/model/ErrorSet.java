package com.delta.jobboard.crawl.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Unique error texts collected during a crawl. Entries are kept sorted so the formatted log does
 * not depend on the order in which records finished.
 */
public final class ErrorSet {
    public static final String SEPARATOR = ";\n";

    private final TreeSet<String> errors = new TreeSet<>();

    public void add(String error) {
        if (error == null || error.isBlank()) {
            return;
        }
        errors.add(error.trim());
    }

    public void addAll(Collection<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            add(value);
        }
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public Set<String> values() {
        return Collections.unmodifiableSet(errors);
    }

    public String format(int maxLength) {
        String joined = String.join(SEPARATOR, errors);
        if (maxLength <= 0) {
            return "";
        }
        if (joined.length() <= maxLength) {
            return joined;
        }
        int end = Character.isHighSurrogate(joined.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return joined.substring(0, end);
    }
}
