package com.delta.jobboard.crawl.persistence;

import com.delta.jobboard.crawl.model.CompanyContext;
import com.delta.jobboard.crawl.model.CrawlStatus;
import com.delta.jobboard.crawl.model.CrawlStatusRecord;
import com.delta.jobboard.crawl.model.JobRecord;
import com.delta.jobboard.crawl.model.MissingDescriptionJob;
import com.delta.jobboard.crawl.model.PersistResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public class JobBoardJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(JobBoardJdbcRepository.class);

    private static final RowMapper<CompanyContext> COMPANY_MAPPER = (rs, rowNum) -> new CompanyContext(
        rs.getLong("id"),
        rs.getString("jobs_url"),
        rs.getString("resource_name")
    );

    private static final RowMapper<CrawlStatusRecord> CRAWL_STATUS_MAPPER = (rs, rowNum) -> new CrawlStatusRecord(
        rs.getLong("company_row_id"),
        rs.getString("output_table"),
        CrawlStatus.valueOf(rs.getString("status")),
        rs.getInt("success_count"),
        rs.getInt("failed_count"),
        rs.getString("error_log"),
        rs.getTimestamp("started_at").toInstant(),
        rs.getTimestamp("finished_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JobBoardJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertCompany(long companyId, String jobsUrl, String resourceName) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("jobsUrl", jobsUrl)
            .addValue("resourceName", resourceName);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO companies (company_id, jobs_url, resource_name)
                VALUES (:companyId, :jobsUrl, :resourceName)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert company row for company " + companyId);
        }
        return key.longValue();
    }

    /**
     * Company rows to crawl. A null {@code companyId} or blank {@code resourceName} does not filter.
     */
    public List<CompanyContext> findCompanies(Long companyId, Collection<Long> excludedUrlIds, String resourceName) {
        StringBuilder sql = new StringBuilder(
            """
                SELECT id, jobs_url, resource_name
                FROM companies
                WHERE 1 = 1
                """
        );
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (companyId != null) {
            sql.append(" AND company_id = :companyId");
            params.addValue("companyId", companyId);
        }
        if (excludedUrlIds != null && !excludedUrlIds.isEmpty()) {
            sql.append(" AND id NOT IN (:excludedUrlIds)");
            params.addValue("excludedUrlIds", excludedUrlIds);
        }
        if (resourceName != null && !resourceName.isBlank()) {
            sql.append(" AND resource_name = :resourceName");
            params.addValue("resourceName", resourceName.trim());
        }
        sql.append(" ORDER BY id");
        return jdbc.query(sql.toString(), params, COMPANY_MAPPER);
    }

    public CompanyContext findCompany(long companyRowId) {
        List<CompanyContext> rows = jdbc.query(
            """
                SELECT id, jobs_url, resource_name
                FROM companies
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", companyRowId),
            COMPANY_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Stores a posting keyed on (company row, output table, url). A posting seen before is refreshed
     * in place and keeps any description already stored.
     */
    public PersistResult insertJob(long companyRowId, JobRecord job) {
        if (job == null || !job.isValid()) {
            return PersistResult.failure("Job record missing title or url for company row " + companyRowId);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyRowId", companyRowId)
            .addValue("outputTable", job.outputTable())
            .addValue("title", job.title())
            .addValue("url", job.url())
            .addValue("location", job.location())
            .addValue("postDate", job.postDate())
            .addValue("description", job.description())
            .addValue("category", job.category())
            .addValue("employmentType", job.employmentType())
            .addValue("now", Timestamp.from(Instant.now()));
        try {
            if (refreshJob(params) > 0) {
                return PersistResult.success();
            }
            jdbc.update(
                """
                    INSERT INTO job_postings (
                        company_row_id, output_table, title, url, location, post_date, description,
                        category, employment_type, created_at, updated_at
                    ) VALUES (
                        :companyRowId, :outputTable, :title, :url, :location, :postDate, :description,
                        :category, :employmentType, :now, :now
                    )
                    """,
                params
            );
            return PersistResult.success();
        } catch (DataIntegrityViolationException e) {
            // same url inserted concurrently by another listing node
            if (refreshJob(params) > 0) {
                return PersistResult.success();
            }
            return PersistResult.failure("Job violates constraints: " + job.url());
        } catch (DataAccessException e) {
            log.warn("Failed to insert job {} for company row {}", job.url(), companyRowId, e);
            return PersistResult.failure("Job insert failed for " + job.url() + ": " + e.getMostSpecificCause().getMessage());
        }
    }

    private int refreshJob(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE job_postings
                SET title = :title,
                    location = :location,
                    post_date = :postDate,
                    category = :category,
                    employment_type = :employmentType,
                    description = COALESCE(NULLIF(description, ''), :description),
                    updated_at = :now
                WHERE company_row_id = :companyRowId
                  AND output_table = :outputTable
                  AND url = :url
                """,
            params
        );
    }

    public List<MissingDescriptionJob> findJobsMissingDescription(long companyRowId, String outputTable, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyRowId", companyRowId)
            .addValue("outputTable", outputTable)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, url
                FROM job_postings
                WHERE company_row_id = :companyRowId
                  AND output_table = :outputTable
                  AND (description IS NULL OR description = '')
                ORDER BY id
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new MissingDescriptionJob(rs.getLong("id"), rs.getString("url"))
        );
    }

    public int updateJobDescription(long jobId, String description) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("description", description)
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update(
            """
                UPDATE job_postings
                SET description = :description,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public CrawlStatusRecord findCrawlStatus(long companyRowId, String outputTable) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyRowId", companyRowId)
            .addValue("outputTable", outputTable);
        List<CrawlStatusRecord> rows = jdbc.query(
            """
                SELECT company_row_id, output_table, status, success_count, failed_count, error_log,
                       started_at, finished_at
                FROM crawl_status
                WHERE company_row_id = :companyRowId
                  AND output_table = :outputTable
                """,
            params,
            CRAWL_STATUS_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void upsertCrawlStatus(CrawlStatusRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyRowId", record.companyRowId())
            .addValue("outputTable", record.outputTable())
            .addValue("status", record.status().name())
            .addValue("successCount", record.successCount())
            .addValue("failedCount", record.failedCount())
            .addValue("errorLog", record.errorLog())
            .addValue("startedAt", Timestamp.from(record.startedAt()))
            .addValue("finishedAt", Timestamp.from(record.finishedAt()));
        int updated = jdbc.update(
            """
                UPDATE crawl_status
                SET status = :status,
                    success_count = :successCount,
                    failed_count = :failedCount,
                    error_log = :errorLog,
                    started_at = :startedAt,
                    finished_at = :finishedAt
                WHERE company_row_id = :companyRowId
                  AND output_table = :outputTable
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO crawl_status (
                    company_row_id, output_table, status, success_count, failed_count, error_log,
                    started_at, finished_at
                ) VALUES (
                    :companyRowId, :outputTable, :status, :successCount, :failedCount, :errorLog,
                    :startedAt, :finishedAt
                )
                """,
            params
        );
    }
}
