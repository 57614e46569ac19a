package com.delta.jobboard.crawl.jobs;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.http.BoardHttpClient;
import com.delta.jobboard.crawl.model.HttpFetchResult;
import com.delta.jobboard.crawl.util.TextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads the long-form description of one posting. Any failure yields an empty description.
 */
@Component
public class DescriptionFetcher {
    private static final Logger log = LoggerFactory.getLogger(DescriptionFetcher.class);
    private static final List<String> DESCRIPTION_REMOVE_ITEMS = List.of("\n", "\t", "\r", "\u00A0", "'", "\"");

    private final BoardHttpClient httpClient;
    private final String descriptionElementId;

    public DescriptionFetcher(BoardHttpClient httpClient, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.descriptionElementId = properties.getBoard().getDescriptionElementId();
    }

    public String fetch(String jobUrl) {
        try {
            HttpFetchResult result = httpClient.get(jobUrl);
            if (result == null || !result.isSuccessful() || result.body() == null) {
                log.debug("Description fetch failed for {}: {}", jobUrl, result == null ? "no_result" : result.describeFailure());
                return "";
            }
            Document document = Jsoup.parse(result.body(), result.finalUrlOrRequested());
            Element description = document.getElementById(descriptionElementId);
            if (description == null) {
                log.debug("No #{} element on {}", descriptionElementId, jobUrl);
                return "";
            }
            String collapsed = TextNormalizer.collapseWhitespace(description.text());
            return TextNormalizer.clean(collapsed, DESCRIPTION_REMOVE_ITEMS);
        } catch (RuntimeException e) {
            log.warn("Description extraction failed for {}", jobUrl, e);
            return "";
        }
    }
}
