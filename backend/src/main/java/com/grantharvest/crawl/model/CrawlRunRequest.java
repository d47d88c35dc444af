package com.grantharvest.crawl.model;

public record CrawlRunRequest(Integer maxPages) {
    public static CrawlRunRequest defaults() {
        return new CrawlRunRequest(null);
    }
}
