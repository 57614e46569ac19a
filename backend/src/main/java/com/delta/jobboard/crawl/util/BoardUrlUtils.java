package com.delta.jobboard.crawl.util;

import java.util.List;
import java.util.Locale;

public final class BoardUrlUtils {
    public static final List<String> FEED_SUFFIXES = List.of("/feed.atom", "/feed.json");

    private BoardUrlUtils() {
    }

    public static String canonicalListingUrl(String rawUrl) {
        if (rawUrl == null) {
            return "";
        }
        String value = rawUrl.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        for (String suffix : FEED_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return value.substring(0, value.length() - suffix.length());
            }
        }
        return value;
    }

    public static String join(String siteBaseUrl, String href) {
        String base = siteBaseUrl == null ? "" : siteBaseUrl.trim();
        return base + (href == null ? "" : href.trim());
    }
}
