package com.delta.jobboard.crawl.service;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.jobs.ListingPageFetcher;
import com.delta.jobboard.crawl.jobs.ListingSource;
import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.CrawlResult;
import com.delta.jobboard.crawl.model.CrawlStatusRecord;
import com.delta.jobboard.crawl.model.CrawlTally;
import com.delta.jobboard.crawl.model.ErrorSet;
import com.delta.jobboard.crawl.model.JobOutcome;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import com.delta.jobboard.crawl.util.BoardUrlUtils;
import com.delta.jobboard.crawl.util.ErrorDetails;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    private final JobProcessor jobProcessor;
    private final ListingPageFetcher listingPageFetcher;
    private final DescriptionBackfillService descriptionBackfillService;
    private final JobBoardJdbcRepository repository;
    private final ExecutorService descriptionExecutor;
    private final CrawlerProperties properties;
    private final Clock clock;

    public CrawlOrchestratorService(
        JobProcessor jobProcessor,
        ListingPageFetcher listingPageFetcher,
        DescriptionBackfillService descriptionBackfillService,
        JobBoardJdbcRepository repository,
        @Qualifier("descriptionExecutor") ExecutorService descriptionExecutor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.jobProcessor = jobProcessor;
        this.listingPageFetcher = listingPageFetcher;
        this.descriptionBackfillService = descriptionBackfillService;
        this.repository = repository;
        this.descriptionExecutor = descriptionExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public CrawlResult run(
        CompanyContext company,
        String outputTable,
        CrawlStatusRecord previousStatus,
        boolean callDescriptionOnly
    ) {
        return run(company, listingPageFetcher, outputTable, previousStatus, callDescriptionOnly);
    }

    /**
     * Crawls one company's board and returns the aggregate result. Record failures are counted;
     * a failure of the crawl itself forces {@code FAILED} but keeps the counts gathered so far.
     * Nothing is thrown to the caller.
     */
    public CrawlResult run(
        CompanyContext company,
        ListingSource listingSource,
        String outputTable,
        CrawlStatusRecord previousStatus,
        boolean callDescriptionOnly
    ) {
        Instant startedAt = clock.instant();
        CrawlTally tally = CrawlTally.EMPTY;
        ErrorSet crawlErrors = new ErrorSet();
        boolean crawlFailed = false;
        Long companyRowId = company == null ? null : company.companyRowId();

        try {
            if (company == null) {
                throw new IllegalArgumentException("No company to crawl");
            }
            String listingUrl = BoardUrlUtils.canonicalListingUrl(company.jobsUrl());
            if (callDescriptionOnly) {
                tally = CrawlTally.carriedForward(previousStatus);
                log.info(
                    "Description-only crawl for company row {}: carrying success={} failed={}",
                    companyRowId,
                    tally.successCount(),
                    tally.failedCount()
                );
            } else {
                List<Element> listings = listingSource.fetchListings(listingUrl);
                tally = processListings(listings, company, outputTable, siteBaseUrl(listingUrl), currentDate());
            }
            descriptionBackfillService.backfill(company.companyRowId(), outputTable);
        } catch (Exception e) {
            crawlFailed = true;
            crawlErrors.add(ErrorDetails.fullText(e));
            log.warn("Crawl failed for company row {}", companyRowId, e);
        }

        CrawlResult result = tally.toResult(crawlErrors, crawlFailed, properties.getErrors().getMaxLogLength());
        Instant finishedAt = clock.instant();
        log.info(
            "Crawl for company row {} finished in {} ms: status={} success={} failed={}",
            companyRowId,
            Duration.between(startedAt, finishedAt).toMillis(),
            result.status(),
            result.successCount(),
            result.failedCount()
        );
        if (company != null) {
            recordStatus(company, outputTable, result, startedAt, finishedAt);
        }
        return result;
    }

    private CrawlTally processListings(
        List<Element> listings,
        CompanyContext company,
        String outputTable,
        String siteBaseUrl,
        String currentDate
    ) {
        if (listings == null || listings.isEmpty()) {
            log.info("No listings for company row {}", company.companyRowId());
            return CrawlTally.EMPTY;
        }
        List<CompletableFuture<JobOutcome>> futures = new ArrayList<>(listings.size());
        for (Element listing : listings) {
            try {
                futures.add(CompletableFuture.supplyAsync(
                    () -> jobProcessor.process(listing, company, outputTable, siteBaseUrl, currentDate),
                    descriptionExecutor
                ));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(JobOutcome.failure(ErrorDetails.fullText(e))));
            }
        }

        List<JobOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<JobOutcome> future : futures) {
            try {
                outcomes.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                outcomes.add(JobOutcome.failure(ErrorDetails.fullText(cause)));
            }
        }
        return CrawlTally.of(outcomes);
    }

    private void recordStatus(
        CompanyContext company,
        String outputTable,
        CrawlResult result,
        Instant startedAt,
        Instant finishedAt
    ) {
        try {
            repository.upsertCrawlStatus(new CrawlStatusRecord(
                company.companyRowId(),
                outputTable,
                result.status(),
                result.successCount(),
                result.failedCount(),
                result.errorLog(),
                startedAt,
                finishedAt
            ));
        } catch (Exception e) {
            log.warn("Failed to store crawl status for company row {}", company.companyRowId(), e);
        }
    }

    String siteBaseUrl(String listingUrl) {
        String configured = properties.getBoard().getSiteBaseUrl();
        if (!configured.isBlank()) {
            return configured;
        }
        try {
            URI uri = new URI(listingUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return "";
            }
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            return uri.getScheme() + "://" + uri.getHost() + port;
        } catch (URISyntaxException e) {
            return "";
        }
    }

    private String currentDate() {
        return LocalDate.now(clock).toString();
    }
}
