package com.delta.jobboard.crawl.util;

import java.util.Collection;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    // \s does not cover non-breaking or other unicode spaces
    private static final Pattern ANY_SPACE_RUN = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");

    private TextNormalizer() {
    }

    /**
     * Collapses whitespace runs to single spaces, trims, then removes every literal in
     * {@code removeItems}. Items are plain substrings, not patterns, and are removed one after another.
     */
    public static String clean(String text, Collection<String> removeItems) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
        if (removeItems == null) {
            return cleaned;
        }
        for (String item : removeItems) {
            if (item != null && !item.isEmpty()) {
                cleaned = cleaned.replace(item, "");
            }
        }
        return cleaned;
    }

    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String[] tokens = ANY_SPACE_RUN.split(text.trim());
        StringBuilder out = new StringBuilder(text.length());
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(token);
        }
        return out.toString();
    }
}
