package com.delta.jobboard.crawl.service;

import com.delta.jobboard.crawl.jobs.ListingSource;
import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.CrawlResult;
import com.delta.jobboard.crawl.model.CrawlStatus;
import com.delta.jobboard.crawl.persistence.JobBoardJdbcRepository;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CrawlOrchestratorRecrawlTest {
    private static final String OUTPUT = "job_postings";

    @Autowired
    private CrawlOrchestratorService crawlOrchestratorService;

    @Autowired
    private JobBoardJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void recrawlingUnchangedBoardStaysSuccessful() {
        long companyRowId = repository.insertCompany(301L, "http://127.0.0.1:1/board", "board");
        CompanyContext company = repository.findCompany(companyRowId);
        ListingSource board = url -> new ArrayList<>(Jsoup.parse(
            "<ul>"
                + "<li class=\"job-listing\"><a href=\"/j/1\">Engineer</a></li>"
                + "<li class=\"job-listing\"><a href=\"/j/2\">Designer</a></li>"
                + "</ul>"
        ).select("li.job-listing"));

        CrawlResult first = crawlOrchestratorService.run(company, board, OUTPUT, null, false);
        CrawlResult second = crawlOrchestratorService.run(
            company, board, OUTPUT, repository.findCrawlStatus(companyRowId, OUTPUT), false);

        assertThat(first).isEqualTo(new CrawlResult(CrawlStatus.SUCCESS, 2, 0, ""));
        assertThat(second).isEqualTo(new CrawlResult(CrawlStatus.SUCCESS, 2, 0, ""));
        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_postings WHERE company_row_id = :id AND output_table = :output",
            new MapSqlParameterSource().addValue("id", companyRowId).addValue("output", OUTPUT),
            Integer.class
        );
        assertThat(rows).isEqualTo(2);
        assertThat(repository.findCrawlStatus(companyRowId, OUTPUT).status()).isEqualTo(CrawlStatus.SUCCESS);
    }
}
