package com.grantharvest.crawl.http;

import com.grantharvest.crawl.model.ListingPage;

/**
 * Retrieves one page of the grant listing. Implementations report transport errors and non-200
 * responses as an unsuccessful {@link ListingPage} rather than throwing.
 */
public interface ListingPageFetcher {
    ListingPage fetch(int pageIndex);
}
