package com.delta.jobboard.crawl.service;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.jobs.DescriptionFetcher;
import com.delta.jobboard.crawl.jobs.ListingFieldExtractor;
import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.JobOutcome;
import com.delta.jobboard.crawl.model.JobRecord;
import com.delta.jobboard.crawl.model.PersistResult;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobProcessorTest {
    private static final String BASE = "https://careers.acme.com";
    private static final String TODAY = "2026-10-19";
    private static final CompanyContext COMPANY = new CompanyContext(5L, "https://careers.acme.com/feed.atom", "board");

    @Mock
    private DescriptionFetcher descriptionFetcher;
    @Mock
    private JobBoardJdbcRepository repository;

    private JobProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new JobProcessor(new ListingFieldExtractor(new CrawlerProperties()), descriptionFetcher, repository);
    }

    @Test
    void assemblesAndStoresFullRecord() {
        Element node = listing(
            """
                <li class="job-listing">
                  <a href="/jobs/42">Data Engineer</a>
                  <span class="location">Lisbon</span>
                  <div class="subtitle">Data | Lisbon | Full-time</div>
                </li>
                """
        );
        when(descriptionFetcher.fetch("https://careers.acme.com/jobs/42")).thenReturn("Build pipelines");
        when(repository.insertJob(eq(5L), any(JobRecord.class))).thenReturn(PersistResult.success());

        JobOutcome outcome = processor.process(node, COMPANY, "job_postings", BASE, TODAY);

        assertThat(outcome.successCount()).isEqualTo(1);
        assertThat(outcome.failedCount()).isZero();
        ArgumentCaptor<JobRecord> captor = ArgumentCaptor.forClass(JobRecord.class);
        verify(repository).insertJob(eq(5L), captor.capture());
        assertThat(captor.getValue()).isEqualTo(new JobRecord(
            "Data Engineer",
            "https://careers.acme.com/jobs/42",
            "Lisbon",
            TODAY,
            "Build pipelines",
            "Data",
            "Full-time",
            "job_postings"
        ));
    }

    @Test
    void persistenceFailureIsCountedWithItsMessage() {
        Element node = listing("<li class=\"job-listing\"><a href=\"/jobs/1\">Analyst</a></li>");
        when(descriptionFetcher.fetch(anyString())).thenReturn("");
        when(repository.insertJob(anyLong(), any(JobRecord.class))).thenReturn(PersistResult.failure("duplicate"));

        JobOutcome outcome = processor.process(node, COMPANY, "job_postings", BASE, TODAY);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.failedCount()).isEqualTo(1);
        assertThat(outcome.successCount()).isZero();
        assertThat(outcome.error()).isEqualTo("duplicate");
    }

    @Test
    void extractionFailureDropsRecordWithFullDetail() {
        Element node = listing("<li class=\"job-listing\"><span class=\"location\">Rome</span></li>");

        JobOutcome outcome = processor.process(node, COMPANY, "job_postings", BASE, TODAY);

        assertThat(outcome.failedCount()).isEqualTo(1);
        assertThat(outcome.error())
            .contains("ListingExtractionException")
            .contains("no anchor")
            .contains("\tat ");
        verify(descriptionFetcher, never()).fetch(anyString());
        verify(repository, never()).insertJob(anyLong(), any(JobRecord.class));
    }

    private Element listing(String html) {
        return Jsoup.parse("<ul>" + html + "</ul>").selectFirst("li");
    }
}
