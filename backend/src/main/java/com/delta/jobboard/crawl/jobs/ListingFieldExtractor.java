package com.delta.jobboard.crawl.jobs;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.model.FieldResult;
import com.delta.jobboard.crawl.model.JobMetadata;
import com.delta.jobboard.crawl.model.ListingFields;
import com.delta.jobboard.crawl.util.BoardUrlUtils;
import com.delta.jobboard.crawl.util.TextNormalizer;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class ListingFieldExtractor {
    private static final Pattern SUBTITLE_DELIMITER = Pattern.compile("\\s*\\|\\s*");
    private static final Set<String> LOCATION_REMOVE_ITEMS = Set.of("%");

    private final CrawlerProperties.Board board;

    public ListingFieldExtractor(CrawlerProperties properties) {
        this.board = properties.getBoard();
    }

    /**
     * Reads title, URL, location and posting date of one listing node. A node without a usable
     * anchor is rejected with {@link ListingExtractionException}; the other fields fall back to
     * defaults.
     */
    public ListingFields extract(Element listingNode, String siteBaseUrl, String currentDate) {
        Element anchor = requireAnchor(listingNode);
        return new ListingFields(
            extractTitle(anchor),
            extractUrl(anchor, siteBaseUrl),
            extractLocation(listingNode).value(),
            extractPostDate(listingNode, currentDate).value()
        );
    }

    public FieldResult<String> extractLocation(Element listingNode) {
        Element span = listingNode == null ? null : listingNode.selectFirst("span." + board.getLocationClass());
        if (span == null) {
            return FieldResult.fallback(board.getDefaultLocation(), "location_marker_missing");
        }
        String location = TextNormalizer.clean(span.text(), LOCATION_REMOVE_ITEMS).replace("'", "\"");
        if (location.isBlank()) {
            return FieldResult.fallback(board.getDefaultLocation(), "location_blank");
        }
        return FieldResult.extracted(location);
    }

    public FieldResult<String> extractPostDate(Element listingNode, String currentDate) {
        Element div = listingNode == null ? null : listingNode.selectFirst("div." + board.getPostDateClass());
        if (div == null) {
            return FieldResult.fallback(currentDate, "post_date_marker_missing");
        }
        String postDate = div.text().trim();
        if (postDate.isBlank()) {
            return FieldResult.fallback(currentDate, "post_date_blank");
        }
        return FieldResult.extracted(postDate);
    }

    /**
     * Category and employment type come from the first subtitle that splits into at least three
     * pipe-separated parts. Later subtitles are not looked at, even if they would also qualify.
     */
    public JobMetadata extractMetadata(List<Element> subtitles) {
        if (subtitles == null) {
            return JobMetadata.EMPTY;
        }
        for (Element subtitle : subtitles) {
            if (subtitle == null) {
                continue;
            }
            String[] parts = SUBTITLE_DELIMITER.split(subtitle.text().trim(), -1);
            if (parts.length >= 3) {
                return new JobMetadata(parts[0].trim(), parts[2].trim());
            }
        }
        return JobMetadata.EMPTY;
    }

    public List<Element> findSubtitles(Element listingNode) {
        if (listingNode == null) {
            return List.of();
        }
        return listingNode.select(board.getSubtitleSelector());
    }

    private Element requireAnchor(Element listingNode) {
        Element anchor = listingNode == null ? null : listingNode.selectFirst("a");
        if (anchor == null) {
            throw new ListingExtractionException("Listing node has no anchor: " + describe(listingNode));
        }
        return anchor;
    }

    private String extractTitle(Element anchor) {
        String title = anchor.text().trim();
        if (title.isEmpty()) {
            throw new ListingExtractionException("Listing anchor has no title text: " + anchor.outerHtml());
        }
        return title;
    }

    private String extractUrl(Element anchor, String siteBaseUrl) {
        String href = anchor.attr("href");
        if (href == null || href.isBlank()) {
            throw new ListingExtractionException("Listing anchor has no href: " + anchor.outerHtml());
        }
        return BoardUrlUtils.join(siteBaseUrl, href);
    }

    private String describe(Element listingNode) {
        if (listingNode == null) {
            return "null";
        }
        String html = listingNode.outerHtml();
        return html.length() > 200 ? html.substring(0, 200) : html;
    }
}
