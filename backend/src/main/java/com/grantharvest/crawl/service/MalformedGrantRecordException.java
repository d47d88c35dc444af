package com.grantharvest.crawl.service;

import com.grantharvest.crawl.model.GrantField;

public class MalformedGrantRecordException extends RuntimeException {
    private final GrantField missingField;
    private final String partialTitle;

    public MalformedGrantRecordException(GrantField missingField, String partialTitle) {
        super("grant record missing required field " + missingField.key()
            + (partialTitle == null ? "" : " (title '" + partialTitle + "')"));
        this.missingField = missingField;
        this.partialTitle = partialTitle;
    }

    public GrantField getMissingField() {
        return missingField;
    }

    public String getPartialTitle() {
        return partialTitle;
    }
}
