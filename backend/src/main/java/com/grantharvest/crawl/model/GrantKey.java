package com.grantharvest.crawl.model;

public record GrantKey(String issuer, String title, String deadline) {
    @Override
    public String toString() {
        return "'" + title + "' by " + issuer + " (deadline " + deadline + ")";
    }
}
