package com.delta.jobboard.crawl.jobs;

import org.jsoup.nodes.Element;

import java.util.List;

@FunctionalInterface
public interface ListingSource {

    /**
     * Returns the listing nodes of a company's job board, one per posting.
     */
    List<Element> fetchListings(String canonicalListingUrl);
}
