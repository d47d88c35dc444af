package com.grantharvest.crawl.model;

public record RecordExtractionError(int pageIndex, String partialTitle, String missingField) {
    public String describe() {
        String title = partialTitle == null ? "<untitled>" : "'" + partialTitle + "'";
        return "page " + pageIndex + " record " + title + " missing " + missingField;
    }
}
