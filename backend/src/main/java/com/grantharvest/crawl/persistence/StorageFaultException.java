package com.grantharvest.crawl.persistence;

/**
 * A persistence failure other than a natural-key collision. Never handled inside the crawl.
 */
public class StorageFaultException extends RuntimeException {
    public StorageFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
