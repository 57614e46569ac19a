package com.delta.jobboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/120.0.0.0 Safari/537.36";
    private static final int MAX_DESCRIPTION_CONCURRENCY = 16;

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private boolean verifyTls = false;
    private int descriptionConcurrency = 8;
    private Board board = new Board();
    private Errors errors = new Errors();
    private Backfill backfill = new Backfill();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public void setVerifyTls(boolean verifyTls) {
        this.verifyTls = verifyTls;
    }

    public int getDescriptionConcurrency() {
        return Math.min(MAX_DESCRIPTION_CONCURRENCY, Math.max(1, descriptionConcurrency));
    }

    public void setDescriptionConcurrency(int descriptionConcurrency) {
        this.descriptionConcurrency = descriptionConcurrency;
    }

    public Board getBoard() {
        return board;
    }

    public void setBoard(Board board) {
        this.board = board;
    }

    public Errors getErrors() {
        return errors;
    }

    public void setErrors(Errors errors) {
        this.errors = errors;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public void setBackfill(Backfill backfill) {
        this.backfill = backfill;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /**
     * Markup markers of the job board page. The defaults match the board layout the adapter was
     * written for; another board with the same structure only needs different class names.
     */
    public static class Board {
        private String siteBaseUrl = "";
        private String listingSelector = "li.job-listing";
        private String locationClass = "location";
        private String postDateClass = "posted-date";
        private String subtitleSelector = ".subtitle";
        private String descriptionElementId = "js-job-description";
        private String defaultLocation = "Global";

        public String getSiteBaseUrl() {
            return siteBaseUrl == null ? "" : siteBaseUrl.trim();
        }

        public void setSiteBaseUrl(String siteBaseUrl) {
            this.siteBaseUrl = siteBaseUrl;
        }

        public String getListingSelector() {
            return listingSelector;
        }

        public void setListingSelector(String listingSelector) {
            this.listingSelector = listingSelector;
        }

        public String getLocationClass() {
            return locationClass;
        }

        public void setLocationClass(String locationClass) {
            this.locationClass = locationClass;
        }

        public String getPostDateClass() {
            return postDateClass;
        }

        public void setPostDateClass(String postDateClass) {
            this.postDateClass = postDateClass;
        }

        public String getSubtitleSelector() {
            return subtitleSelector;
        }

        public void setSubtitleSelector(String subtitleSelector) {
            this.subtitleSelector = subtitleSelector;
        }

        public String getDescriptionElementId() {
            return descriptionElementId;
        }

        public void setDescriptionElementId(String descriptionElementId) {
            this.descriptionElementId = descriptionElementId;
        }

        public String getDefaultLocation() {
            return defaultLocation;
        }

        public void setDefaultLocation(String defaultLocation) {
            this.defaultLocation = defaultLocation;
        }
    }

    public static class Errors {
        private int maxLogLength = 2000;

        public int getMaxLogLength() {
            return Math.max(1, maxLogLength);
        }

        public void setMaxLogLength(int maxLogLength) {
            this.maxLogLength = Math.max(1, maxLogLength);
        }
    }

    public static class Backfill {
        private boolean enabled = true;
        private int batchSize = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }
    }

    public static class Cli {
        private boolean run = false;
        private Long companyId;
        private String excludedUrlIds = "";
        private String resourceName = "";
        private String outputTable = "job_postings";
        private boolean descriptionOnly = false;
        private boolean exitAfterRun = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public Long getCompanyId() {
            return companyId;
        }

        public void setCompanyId(Long companyId) {
            this.companyId = companyId;
        }

        public String getExcludedUrlIds() {
            return excludedUrlIds == null ? "" : excludedUrlIds;
        }

        public void setExcludedUrlIds(String excludedUrlIds) {
            this.excludedUrlIds = excludedUrlIds;
        }

        public String getResourceName() {
            return resourceName == null ? "" : resourceName.trim();
        }

        public void setResourceName(String resourceName) {
            this.resourceName = resourceName;
        }

        public String getOutputTable() {
            return outputTable;
        }

        public void setOutputTable(String outputTable) {
            this.outputTable = outputTable;
        }

        public boolean isDescriptionOnly() {
            return descriptionOnly;
        }

        public void setDescriptionOnly(boolean descriptionOnly) {
            this.descriptionOnly = descriptionOnly;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
