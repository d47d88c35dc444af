package com.grantharvest.crawl.http;

import com.grantharvest.config.HarvesterProperties;
import com.grantharvest.crawl.model.ListingPage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class JsoupListingPageFetcherTest {

    @Test
    void appendsPageIndexToListingUrl() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setListingUrl("https://example.org/grants?page=");
        JsoupListingPageFetcher fetcher = new JsoupListingPageFetcher(properties);

        assertEquals("https://example.org/grants?page=0", fetcher.pageUrl(0));
        assertEquals("https://example.org/grants?page=12", fetcher.pageUrl(12));
    }

    @Test
    void transportErrorBecomesFailedPage() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setListingUrl("http://127.0.0.1:1/grants?page=");
        properties.setRequestTimeoutSeconds(2);
        JsoupListingPageFetcher fetcher = new JsoupListingPageFetcher(properties);

        ListingPage page = fetcher.fetch(3);

        assertFalse(page.isSuccessful());
        assertEquals(3, page.pageIndex());
        assertEquals(0, page.statusCode());
        assertNull(page.document());
        assertNotNull(page.errorMessage());
    }
}
