package com.grantharvest.crawl.extract;

import com.grantharvest.crawl.model.GrantField;
import com.grantharvest.crawl.model.RawGrantRecord;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the grants listing markup: one {@code div.views-row} per grant, each field in a
 * {@code views-field-*} block.
 */
@Component
public class PwGrantListingExtractor implements GrantRecordExtractor {
    static final String ROW_SELECTOR = "div.views-row";

    private static final Map<GrantField, String> TEXT_SELECTORS = textSelectors();
    private static final String BODY_SELECTOR = "div.views-field-body div.field-content";

    @Override
    public List<RawGrantRecord> extract(Document document) {
        if (document == null) {
            return List.of();
        }
        List<RawGrantRecord> records = new ArrayList<>();
        for (Element row : document.select(ROW_SELECTOR)) {
            records.add(extractRow(row));
        }
        return records;
    }

    private RawGrantRecord extractRow(Element row) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<GrantField, String> entry : TEXT_SELECTORS.entrySet()) {
            putIfPresent(fields, entry.getKey(), textOf(row.selectFirst(entry.getValue())));
        }

        Element body = row.selectFirst(BODY_SELECTOR);
        if (body != null) {
            putIfPresent(fields, GrantField.DESCRIPTION, textOf(body.selectFirst("p")));
            Element more = body.selectFirst("a.views-more-link");
            if (more != null && more.hasAttr("href")) {
                putIfPresent(fields, GrantField.READ_MORE_LINK, more.attr("href"));
            }
        }
        return new RawGrantRecord(fields);
    }

    private static void putIfPresent(Map<String, String> fields, GrantField field, String value) {
        if (value != null) {
            fields.put(field.key(), value.trim());
        }
    }

    private static String textOf(Element element) {
        return element == null ? null : element.text();
    }

    private static Map<GrantField, String> textSelectors() {
        Map<GrantField, String> selectors = new LinkedHashMap<>();
        selectors.put(GrantField.ISSUER, "div.views-field-field-award-issuer h2");
        selectors.put(GrantField.TITLE, "div.views-field-title h2");
        selectors.put(GrantField.CASH_PRIZE, "div.views-field-field-cash-prize span.field-content");
        selectors.put(GrantField.ENTRY_FEE, "div.views-field-field-entry-amount-int span.field-content");
        selectors.put(GrantField.DEADLINE, "div.views-field-field-deadline span.field-content");
        selectors.put(GrantField.GENRES, "div.views-field-taxonomy-vocabulary-3 span.field-content");
        return selectors;
    }
}
