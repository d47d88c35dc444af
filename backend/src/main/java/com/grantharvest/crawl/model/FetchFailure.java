package com.grantharvest.crawl.model;

public record FetchFailure(int pageIndex, int statusCode, String message) {}
