package com.grantharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "grant-harvester/0.1 (+contact)";
    private static final String DEFAULT_LISTING_URL = "https://www.pw.org/grants?page=";
    private static final String DEFAULT_BASE_ORIGIN = "https://www.pw.org";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private String listingUrl = DEFAULT_LISTING_URL;
    private String baseOrigin = DEFAULT_BASE_ORIGIN;
    private int maxPages = 500;
    private int maxErrorSamples = 10;
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
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public String getListingUrl() {
        return listingUrl;
    }

    public void setListingUrl(String listingUrl) {
        this.listingUrl = listingUrl == null || listingUrl.isBlank() ? DEFAULT_LISTING_URL : listingUrl.trim();
    }

    public String getBaseOrigin() {
        return baseOrigin;
    }

    public void setBaseOrigin(String baseOrigin) {
        if (baseOrigin == null || baseOrigin.isBlank()) {
            this.baseOrigin = DEFAULT_BASE_ORIGIN;
            return;
        }
        String trimmed = baseOrigin.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseOrigin = trimmed;
    }

    /**
     * Upper bound on pages fetched per run. The listing is expected to end with an empty page or a
     * failed fetch long before this is reached.
     */
    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getMaxErrorSamples() {
        return Math.max(0, maxErrorSamples);
    }

    public void setMaxErrorSamples(int maxErrorSamples) {
        this.maxErrorSamples = Math.max(0, maxErrorSamples);
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    private String normalizeUserAgent(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return value.trim();
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;
        private boolean dumpAfterRun = true;
        private String dumpCsv = "";

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public boolean isDumpAfterRun() {
            return dumpAfterRun;
        }

        public void setDumpAfterRun(boolean dumpAfterRun) {
            this.dumpAfterRun = dumpAfterRun;
        }

        public String getDumpCsv() {
            return dumpCsv;
        }

        public void setDumpCsv(String dumpCsv) {
            this.dumpCsv = dumpCsv == null ? "" : dumpCsv.trim();
        }
    }
}
