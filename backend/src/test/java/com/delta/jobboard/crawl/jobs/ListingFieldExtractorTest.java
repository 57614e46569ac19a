package com.delta.jobboard.crawl.jobs;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.model.FieldResult;
import com.delta.jobboard.crawl.model.JobMetadata;
import com.delta.jobboard.crawl.model.ListingFields;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingFieldExtractorTest {
    private static final String BASE = "https://careers.acme.com";
    private static final String TODAY = "2026-10-19";

    private final ListingFieldExtractor extractor = new ListingFieldExtractor(new CrawlerProperties());

    @Test
    void extractsAllListingFields() {
        Element node = listing(
            """
                <li class="job-listing">
                  <a href="/jobs/42-senior-engineer">  Senior Engineer </a>
                  <span class="location">Berlin, 100% 'Remote'</span>
                  <div class="posted-date">2026-10-01</div>
                  <div class="subtitle">Engineering | Berlin | Full-time</div>
                </li>
                """
        );

        ListingFields fields = extractor.extract(node, BASE, TODAY);

        assertThat(fields.title()).isEqualTo("Senior Engineer");
        assertThat(fields.url()).isEqualTo("https://careers.acme.com/jobs/42-senior-engineer");
        assertThat(fields.location()).isEqualTo("Berlin, 100 \"Remote\"");
        assertThat(fields.postDate()).isEqualTo("2026-10-01");
    }

    @Test
    void missingLocationAndDateFallBackToDefaults() {
        Element node = listing("<li class=\"job-listing\"><a href=\"/jobs/7\">Analyst</a></li>");

        ListingFields fields = extractor.extract(node, BASE, TODAY);
        FieldResult<String> location = extractor.extractLocation(node);

        assertThat(fields.location()).isEqualTo("Global");
        assertThat(fields.postDate()).isEqualTo(TODAY);
        assertThat(location.defaulted()).isTrue();
        assertThat(location.reason()).isEqualTo("location_marker_missing");
    }

    @Test
    void missingAnchorFailsTheRecord() {
        Element node = listing("<li class=\"job-listing\"><span class=\"location\">Paris</span></li>");

        assertThatThrownBy(() -> extractor.extract(node, BASE, TODAY))
            .isInstanceOf(ListingExtractionException.class)
            .hasMessageContaining("no anchor");
    }

    @Test
    void anchorWithoutHrefFailsTheRecord() {
        Element node = listing("<li class=\"job-listing\"><a>Analyst</a></li>");

        assertThatThrownBy(() -> extractor.extract(node, BASE, TODAY))
            .isInstanceOf(ListingExtractionException.class)
            .hasMessageContaining("no href");
    }

    @Test
    void firstQualifyingSubtitleWins() {
        List<Element> subtitles = subtitles("Eng | Remote | FT", "Sales | Remote | PT");

        JobMetadata metadata = extractor.extractMetadata(subtitles);

        assertThat(metadata).isEqualTo(new JobMetadata("Eng", "FT"));
    }

    @Test
    void subtitlesWithFewerThanThreePartsAreSkipped() {
        JobMetadata metadata = extractor.extractMetadata(subtitles("Posted today", "Ops|Full-time", "Ops|Lisbon|Contract"));

        assertThat(metadata).isEqualTo(new JobMetadata("Ops", "Contract"));
    }

    @Test
    void noQualifyingSubtitleYieldsEmptyMetadata() {
        assertThat(extractor.extractMetadata(subtitles("Posted today", "Ops | Full-time"))).isEqualTo(JobMetadata.EMPTY);
        assertThat(extractor.extractMetadata(List.of())).isEqualTo(new JobMetadata("", ""));
    }

    @Test
    void findsSubtitlesInsideListingNode() {
        Element node = listing(
            """
                <li class="job-listing">
                  <a href="/jobs/1">Designer</a>
                  <div class="subtitle">Design | Remote | Part-time</div>
                </li>
                """
        );

        assertThat(extractor.extractMetadata(extractor.findSubtitles(node)))
            .isEqualTo(new JobMetadata("Design", "Part-time"));
    }

    private Element listing(String html) {
        return Jsoup.parse("<ul>" + html + "</ul>").selectFirst("li");
    }

    private List<Element> subtitles(String... texts) {
        StringBuilder html = new StringBuilder();
        for (String text : texts) {
            html.append("<div class=\"subtitle\">").append(text).append("</div>");
        }
        return Jsoup.parse(html.toString()).select("div.subtitle");
    }
}
