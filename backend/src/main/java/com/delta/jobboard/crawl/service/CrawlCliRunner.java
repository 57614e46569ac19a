package com.delta.jobboard.crawl.service;

import com.delta.jobboard.config.CrawlerProperties;
import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.CrawlResult;
import com.delta.jobboard.crawl.model.CrawlStatus;
import com.delta.jobboard.crawl.model.CrawlStatusRecord;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final JobBoardJdbcRepository repository;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        JobBoardJdbcRepository repository,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.repository = repository;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        CrawlerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<Long> excludedUrlIds = parseIds(cli.getExcludedUrlIds());
        List<CompanyContext> companies = repository.findCompanies(cli.getCompanyId(), excludedUrlIds, cli.getResourceName());
        log.info("CLI crawl: {} company rows (resource={}, output={})", companies.size(), cli.getResourceName(), cli.getOutputTable());

        int failed = 0;
        for (CompanyContext company : companies) {
            CrawlStatusRecord previous = repository.findCrawlStatus(company.companyRowId(), cli.getOutputTable());
            CrawlResult result = crawlOrchestratorService.run(company, cli.getOutputTable(), previous, cli.isDescriptionOnly());
            if (result.status() == CrawlStatus.FAILED) {
                failed++;
            }
            log.info(
                "Summary company row {}: status={}, success={}, failed={}",
                company.companyRowId(),
                result.status(),
                result.successCount(),
                result.failedCount()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = failed == 0 ? 0 : 1;
            System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
        }
    }

    static List<Long> parseIds(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .map(Long::parseLong)
            .toList();
    }
}
