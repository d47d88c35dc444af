package com.grantharvest.crawl.model;

public enum CrawlState {
    CRAWLING,
    DONE
}
