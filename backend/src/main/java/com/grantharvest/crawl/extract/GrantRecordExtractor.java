package com.grantharvest.crawl.extract;

import com.grantharvest.crawl.model.RawGrantRecord;
import org.jsoup.nodes.Document;

import java.util.List;

public interface GrantRecordExtractor {
    /**
     * Returns the listing entries found on the page in document order. An empty list marks the end
     * of the result set.
     */
    List<RawGrantRecord> extract(Document document);
}
