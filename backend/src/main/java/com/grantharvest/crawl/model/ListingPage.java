package com.grantharvest.crawl.model;

import org.jsoup.nodes.Document;

public record ListingPage(
    int pageIndex,
    String url,
    int statusCode,
    Document document,
    String errorMessage
) {
    public static ListingPage ok(int pageIndex, String url, Document document) {
        return new ListingPage(pageIndex, url, 200, document, null);
    }

    public static ListingPage failed(int pageIndex, String url, int statusCode, String errorMessage) {
        return new ListingPage(pageIndex, url, statusCode, null, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode == 200 && document != null && errorMessage == null;
    }
}
