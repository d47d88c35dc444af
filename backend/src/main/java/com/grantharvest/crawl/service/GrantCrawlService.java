package com.grantharvest.crawl.service;

import com.grantharvest.config.HarvesterProperties;
import com.grantharvest.crawl.extract.GrantRecordExtractor;
import com.grantharvest.crawl.http.ListingPageFetcher;
import com.grantharvest.crawl.model.CrawlRunRequest;
import com.grantharvest.crawl.model.CrawlRunSummary;
import com.grantharvest.crawl.model.CrawlState;
import com.grantharvest.crawl.model.CrawlStopReason;
import com.grantharvest.crawl.model.FetchFailure;
import com.grantharvest.crawl.model.Grant;
import com.grantharvest.crawl.model.GrantInsertResult;
import com.grantharvest.crawl.model.ListingPage;
import com.grantharvest.crawl.model.RawGrantRecord;
import com.grantharvest.crawl.model.RecordExtractionError;
import com.grantharvest.crawl.persistence.GrantJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Walks the listing one page at a time, starting at page 0, and writes every canonical grant to the
 * grant store as soon as it is built.
 *
 * <p>A run ends on the first empty page, the first failed fetch, or after the configured page limit.
 * Malformed records and duplicates are counted and skipped. A {@code StorageFaultException} from the
 * store ends the run by propagating to the caller.
 */
@Service
public class GrantCrawlService {
    private static final Logger log = LoggerFactory.getLogger(GrantCrawlService.class);

    private final ListingPageFetcher fetcher;
    private final GrantRecordExtractor extractor;
    private final GrantCanonicalizer canonicalizer;
    private final GrantJdbcRepository grantRepository;
    private final HarvesterProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public GrantCrawlService(
        ListingPageFetcher fetcher,
        GrantRecordExtractor extractor,
        GrantCanonicalizer canonicalizer,
        GrantJdbcRepository grantRepository,
        HarvesterProperties properties
    ) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.canonicalizer = canonicalizer;
        this.grantRepository = grantRepository;
        this.properties = properties;
    }

    public CrawlRunSummary run() {
        return run(CrawlRunRequest.defaults());
    }

    public CrawlRunSummary run(CrawlRunRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveCrawlRunException("A grant crawl is already in progress");
        }
        try {
            return crawl(resolveMaxPages(request));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CrawlRunSummary crawl(int maxPages) {
        Instant startedAt = Instant.now();
        RunCounts counts = new RunCounts();
        ErrorCollector errors = new ErrorCollector(properties.getMaxErrorSamples());
        CrawlState state = CrawlState.CRAWLING;
        CrawlStopReason stopReason = CrawlStopReason.PAGE_LIMIT;
        FetchFailure fetchFailure = null;
        int pageIndex = 0;

        log.info("Grant crawl started (maxPages={})", maxPages);
        while (state == CrawlState.CRAWLING) {
            if (pageIndex >= maxPages) {
                log.warn("Stopping crawl at page limit {}", maxPages);
                stopReason = CrawlStopReason.PAGE_LIMIT;
                state = CrawlState.DONE;
                continue;
            }

            ListingPage page = fetcher.fetch(pageIndex);
            if (page == null || !page.isSuccessful()) {
                fetchFailure = page == null
                    ? new FetchFailure(pageIndex, 0, "no response")
                    : new FetchFailure(pageIndex, page.statusCode(), page.errorMessage());
                log.warn(
                    "Failed to retrieve page {}: status={} message={}",
                    fetchFailure.pageIndex(),
                    fetchFailure.statusCode(),
                    fetchFailure.message()
                );
                errors.add("fetch failed on page " + pageIndex + " with status " + fetchFailure.statusCode());
                stopReason = CrawlStopReason.FETCH_FAILURE;
                state = CrawlState.DONE;
                continue;
            }

            List<RawGrantRecord> records = extractor.extract(page.document());
            if (records == null || records.isEmpty()) {
                log.info("No more grants found on page {}. Stopping.", pageIndex);
                stopReason = CrawlStopReason.END_OF_RESULTS;
                state = CrawlState.DONE;
                continue;
            }

            log.info("Number of grants found on page {}: {}", pageIndex, records.size());
            counts.pagesCrawled++;
            counts.recordsFetched += records.size();
            for (RawGrantRecord raw : records) {
                storeRecord(pageIndex, raw, counts, errors);
            }
            pageIndex++;
        }

        Instant finishedAt = Instant.now();
        log.info(
            "Grant crawl finished. stopReason={}, pages={}, fetched={}, inserted={}, duplicates={}, malformed={}",
            stopReason,
            counts.pagesCrawled,
            counts.recordsFetched,
            counts.inserted,
            counts.duplicates,
            counts.malformed
        );
        return new CrawlRunSummary(
            startedAt,
            finishedAt,
            counts.pagesCrawled,
            stopReason,
            counts.recordsFetched,
            counts.inserted,
            counts.duplicates,
            counts.malformed,
            fetchFailure,
            errors.sampleErrors()
        );
    }

    private void storeRecord(int pageIndex, RawGrantRecord raw, RunCounts counts, ErrorCollector errors) {
        Grant grant;
        try {
            grant = canonicalizer.canonicalize(raw);
        } catch (MalformedGrantRecordException e) {
            RecordExtractionError error = new RecordExtractionError(
                pageIndex,
                e.getPartialTitle(),
                e.getMissingField().key()
            );
            log.warn("Skipping malformed grant: {}", error.describe());
            counts.malformed++;
            errors.add(error.describe());
            return;
        }

        GrantInsertResult result = grantRepository.insert(grant);
        if (result.isDuplicate()) {
            log.info("Grant already exists: {}", grant.naturalKey());
            counts.duplicates++;
            return;
        }
        counts.inserted++;
    }

    private int resolveMaxPages(CrawlRunRequest request) {
        if (request == null || request.maxPages() == null) {
            return properties.getMaxPages();
        }
        return Math.max(1, request.maxPages());
    }

    private static class RunCounts {
        private int pagesCrawled;
        private int recordsFetched;
        private int inserted;
        private int duplicates;
        private int malformed;
    }

    private static class ErrorCollector {
        private final int maxSamples;
        private final List<String> sampleErrors = new ArrayList<>();

        private ErrorCollector(int maxSamples) {
            this.maxSamples = maxSamples;
        }

        private void add(String message) {
            if (sampleErrors.size() < maxSamples) {
                sampleErrors.add(message);
            }
        }

        private List<String> sampleErrors() {
            return List.copyOf(sampleErrors);
        }
    }
}
