package com.delta.jobboard.crawl.jobs;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.http.BoardHttpClient;
import com.delta.jobboard.crawl.model.HttpFetchResult;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListingPageFetcherTest {
    private static final String BOARD_URL = "https://careers.acme.com";

    @Mock
    private BoardHttpClient httpClient;

    @Test
    void selectsListingNodes() {
        String html =
            """
                <html><body>
                  <ul>
                    <li class="job-listing"><a href="/jobs/1">One</a></li>
                    <li class="job-listing"><a href="/jobs/2">Two</a></li>
                    <li class="nav">Menu</li>
                  </ul>
                </body></html>
                """;
        when(httpClient.get(BOARD_URL)).thenReturn(new HttpFetchResult(
            BOARD_URL, null, 200, html, "text/html", Instant.now(), Duration.ZERO, null, null));

        List<Element> listings = new ListingPageFetcher(httpClient, new CrawlerProperties()).fetchListings(BOARD_URL);

        assertThat(listings).hasSize(2);
        assertThat(listings.get(1).selectFirst("a").text()).isEqualTo("Two");
    }

    @Test
    void failedListingFetchRaises() {
        when(httpClient.get(BOARD_URL)).thenReturn(new HttpFetchResult(
            BOARD_URL, null, 503, "busy", "text/plain", Instant.now(), Duration.ZERO, null, null));

        ListingPageFetcher fetcher = new ListingPageFetcher(httpClient, new CrawlerProperties());

        assertThatThrownBy(() -> fetcher.fetchListings(BOARD_URL))
            .isInstanceOf(ListingFetchException.class)
            .hasMessageContaining("http_503");
    }
}
