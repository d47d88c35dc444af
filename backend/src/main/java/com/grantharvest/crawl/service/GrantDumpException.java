package com.grantharvest.crawl.service;

import java.io.IOException;

/**
 * The crawl finished but the CSV dump of the store could not be written.
 */
public class GrantDumpException extends RuntimeException {
    public GrantDumpException(String message, IOException cause) {
        super(message, cause);
    }
}
