package com.delta.jobboard.crawl.service;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.jobs.DescriptionFetcher;
import com.delta.jobboard.crawl.model.MissingDescriptionJob;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DescriptionBackfillService {
    private static final Logger log = LoggerFactory.getLogger(DescriptionBackfillService.class);

    private final JobBoardJdbcRepository repository;
    private final DescriptionFetcher descriptionFetcher;
    private final CrawlerProperties properties;

    public DescriptionBackfillService(
        JobBoardJdbcRepository repository,
        DescriptionFetcher descriptionFetcher,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.descriptionFetcher = descriptionFetcher;
        this.properties = properties;
    }

    /**
     * Fills empty descriptions of stored postings. Postings whose description still cannot be
     * fetched are left empty for the next pass. Database errors propagate.
     *
     * @return number of postings updated
     */
    public int backfill(long companyRowId, String outputTable) {
        if (!properties.getBackfill().isEnabled()) {
            return 0;
        }
        List<MissingDescriptionJob> missing = repository.findJobsMissingDescription(
            companyRowId,
            outputTable,
            properties.getBackfill().getBatchSize()
        );
        int updated = 0;
        for (MissingDescriptionJob job : missing) {
            String description = descriptionFetcher.fetch(job.url());
            if (description.isBlank()) {
                continue;
            }
            updated += repository.updateJobDescription(job.jobId(), description);
        }
        log.info(
            "Description backfill for company row {} ({}): missing={} updated={}",
            companyRowId,
            outputTable,
            missing.size(),
            updated
        );
        return updated;
    }
}
