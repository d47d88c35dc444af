package com.grantharvest.crawl;

import com.grantharvest.crawl.http.ListingPageFetcher;
import com.grantharvest.crawl.model.ListingPage;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves stubbed listing pages by index. Unstubbed indexes answer 404.
 */
public class FakeListingPageFetcher implements ListingPageFetcher {
    private final Map<Integer, ListingPage> pages = new LinkedHashMap<>();
    private final List<Integer> requested = new ArrayList<>();

    public FakeListingPageFetcher stub(int pageIndex, Document document) {
        pages.put(pageIndex, ListingPage.ok(pageIndex, url(pageIndex), document));
        return this;
    }

    public FakeListingPageFetcher fail(int pageIndex, int statusCode) {
        pages.put(pageIndex, ListingPage.failed(pageIndex, url(pageIndex), statusCode, "stubbed failure"));
        return this;
    }

    public void reset() {
        pages.clear();
        requested.clear();
    }

    public List<Integer> requested() {
        return List.copyOf(requested);
    }

    @Override
    public ListingPage fetch(int pageIndex) {
        requested.add(pageIndex);
        ListingPage page = pages.get(pageIndex);
        if (page == null) {
            return ListingPage.failed(pageIndex, url(pageIndex), 404, "Not Found");
        }
        return page;
    }

    private static String url(int pageIndex) {
        return "https://grants.test/listing?page=" + pageIndex;
    }
}
