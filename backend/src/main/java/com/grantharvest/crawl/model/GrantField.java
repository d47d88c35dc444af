package com.grantharvest.crawl.model;

public enum GrantField {
    ISSUER("issuer", true),
    TITLE("title", true),
    CASH_PRIZE("cash_prize", true),
    ENTRY_FEE("entry_fee", true),
    DEADLINE("deadline", true),
    GENRES("genres", true),
    DESCRIPTION("description", true),
    READ_MORE_LINK("read_more_link", false),
    EXTRA_INFO("extra_info", false);

    private final String key;
    private final boolean required;

    GrantField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }

    public String key() {
        return key;
    }

    public boolean isRequired() {
        return required;
    }
}
