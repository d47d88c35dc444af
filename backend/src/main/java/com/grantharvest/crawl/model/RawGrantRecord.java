package com.grantharvest.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field text pulled off one listing entry, keyed by {@link GrantField#key()}. Fields the page did not
 * carry are simply absent.
 */
public record RawGrantRecord(Map<String, String> fields) {

    public RawGrantRecord {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String get(GrantField field) {
        return fields.get(field.key());
    }

    public boolean has(GrantField field) {
        return fields.get(field.key()) != null;
    }
}
