package com.grantharvest.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int pagesCrawled,
    CrawlStopReason stopReason,
    int recordsFetched,
    int inserted,
    int duplicates,
    int malformed,
    FetchFailure fetchFailure,
    List<String> sampleErrors) {}
