package com.grantharvest.crawl.model;

public enum CrawlStopReason {
    END_OF_RESULTS,
    FETCH_FAILURE,
    PAGE_LIMIT
}
