package com.grantharvest.crawl.model;

public record GrantInsertResult(Status status, Long grantId) {

    public enum Status {
        INSERTED,
        DUPLICATE
    }

    public static GrantInsertResult inserted(long grantId) {
        return new GrantInsertResult(Status.INSERTED, grantId);
    }

    public static GrantInsertResult duplicate() {
        return new GrantInsertResult(Status.DUPLICATE, null);
    }

    public boolean isInserted() {
        return status == Status.INSERTED;
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }
}
