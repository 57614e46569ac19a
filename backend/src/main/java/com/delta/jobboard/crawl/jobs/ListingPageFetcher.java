package com.delta.jobboard.crawl.jobs;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.http.BoardHttpClient;
import com.delta.jobboard.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ListingPageFetcher implements ListingSource {
    private static final Logger log = LoggerFactory.getLogger(ListingPageFetcher.class);

    private final BoardHttpClient httpClient;
    private final String listingSelector;

    public ListingPageFetcher(BoardHttpClient httpClient, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.listingSelector = properties.getBoard().getListingSelector();
    }

    @Override
    public List<Element> fetchListings(String canonicalListingUrl) {
        HttpFetchResult result = httpClient.get(canonicalListingUrl);
        if (result == null || !result.isSuccessful() || result.body() == null) {
            String reason = result == null ? "no_result" : result.describeFailure();
            throw new ListingFetchException("Listing page fetch failed for " + canonicalListingUrl + " (" + reason + ")");
        }
        Document document = Jsoup.parse(result.body(), result.finalUrlOrRequested());
        List<Element> listings = document.select(listingSelector);
        log.info("Found {} listings on {}", listings.size(), canonicalListingUrl);
        return listings;
    }
}
