package com.delta.jobboard.crawl.api;

import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.CrawlResult;
import com.delta.jobboard.crawl.model.CrawlStatusRecord;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import com.delta.jobboard.crawl.service.CrawlOrchestratorService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/crawl")
public class CrawlController {
    private static final String DEFAULT_OUTPUT_TABLE = "job_postings";

    private final CrawlOrchestratorService crawlOrchestratorService;
    private final JobBoardJdbcRepository repository;

    public CrawlController(CrawlOrchestratorService crawlOrchestratorService, JobBoardJdbcRepository repository) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.repository = repository;
    }

    @PostMapping("/{companyRowId}")
    public CrawlResult runCrawl(
        @PathVariable long companyRowId,
        @RequestParam(name = "outputTable", required = false, defaultValue = DEFAULT_OUTPUT_TABLE) String outputTable,
        @RequestParam(name = "descriptionOnly", required = false, defaultValue = "false") boolean descriptionOnly
    ) {
        CompanyContext company = requireCompany(companyRowId);
        CrawlStatusRecord previous = repository.findCrawlStatus(companyRowId, outputTable);
        return crawlOrchestratorService.run(company, outputTable, previous, descriptionOnly);
    }

    @GetMapping("/{companyRowId}/status")
    public CrawlStatusRecord status(
        @PathVariable long companyRowId,
        @RequestParam(name = "outputTable", required = false, defaultValue = DEFAULT_OUTPUT_TABLE) String outputTable
    ) {
        requireCompany(companyRowId);
        CrawlStatusRecord status = repository.findCrawlStatus(companyRowId, outputTable);
        if (status == null) {
            throw new ResponseStatusException(NOT_FOUND, "No crawl recorded for company row " + companyRowId);
        }
        return status;
    }

    private CompanyContext requireCompany(long companyRowId) {
        CompanyContext company = repository.findCompany(companyRowId);
        if (company == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown company row " + companyRowId);
        }
        return company;
    }
}
