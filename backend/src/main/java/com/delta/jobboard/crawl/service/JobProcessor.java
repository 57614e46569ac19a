package com.delta.jobboard.crawl.service;

import com.delta.jobboard.crawl.jobs.DescriptionFetcher;
import com.delta.jobboard.crawl.jobs.ListingFieldExtractor;
import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.JobMetadata;
import com.delta.jobboard.crawl.model.JobOutcome;
import com.delta.jobboard.crawl.model.JobRecord;
import com.delta.jobboard.crawl.model.ListingFields;
import com.delta.jobboard.crawl.model.PersistResult;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import com.delta.jobboard.crawl.util.ErrorDetails;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final ListingFieldExtractor listingFieldExtractor;
    private final DescriptionFetcher descriptionFetcher;
    private final JobBoardJdbcRepository repository;

    public JobProcessor(
        ListingFieldExtractor listingFieldExtractor,
        DescriptionFetcher descriptionFetcher,
        JobBoardJdbcRepository repository
    ) {
        this.listingFieldExtractor = listingFieldExtractor;
        this.descriptionFetcher = descriptionFetcher;
        this.repository = repository;
    }

    /**
     * Extracts, enriches and stores one listing node. Never throws: an extraction error drops the
     * record and is reported with its full stack trace.
     */
    public JobOutcome process(
        Element listingNode,
        CompanyContext company,
        String outputTable,
        String siteBaseUrl,
        String currentDate
    ) {
        JobRecord job;
        try {
            ListingFields fields = listingFieldExtractor.extract(listingNode, siteBaseUrl, currentDate);
            JobMetadata metadata = listingFieldExtractor.extractMetadata(listingFieldExtractor.findSubtitles(listingNode));
            String description = descriptionFetcher.fetch(fields.url());
            job = new JobRecord(
                fields.title(),
                fields.url(),
                fields.location(),
                fields.postDate(),
                description,
                metadata.category(),
                metadata.employmentType(),
                outputTable
            );
        } catch (Exception e) {
            String detail = ErrorDetails.fullText(e);
            log.warn("Dropping listing for company row {}: {}", company.companyRowId(), detail);
            return JobOutcome.failure(detail);
        }

        PersistResult persisted = repository.insertJob(company.companyRowId(), job);
        if (persisted != null && persisted.ok()) {
            log.debug("Stored job {} ({})", job.title(), job.url());
            return JobOutcome.success();
        }
        String message = persisted == null ? "Job insert returned no result for " + job.url() : persisted.errorMessage();
        log.warn("Job insert failed for company row {}: {}", company.companyRowId(), message);
        return JobOutcome.failure(message);
    }
}
