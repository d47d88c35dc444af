package com.grantharvest.crawl.service;

import com.grantharvest.config.HarvesterProperties;
import com.grantharvest.crawl.model.Grant;
import com.grantharvest.crawl.model.GrantField;
import com.grantharvest.crawl.model.RawGrantRecord;
import com.grantharvest.crawl.util.GrantUrlUtils;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

@Component
public class GrantCanonicalizer {
    // Natural-key fields must carry text; the rest only need to be present.
    private static final Set<GrantField> NON_BLANK = EnumSet.of(GrantField.ISSUER, GrantField.TITLE, GrantField.DEADLINE);

    private final HarvesterProperties properties;

    public GrantCanonicalizer(HarvesterProperties properties) {
        this.properties = properties;
    }

    public Grant canonicalize(RawGrantRecord raw) {
        String partialTitle = normalizeText(raw.get(GrantField.TITLE));
        for (GrantField field : GrantField.values()) {
            if (!field.isRequired()) {
                continue;
            }
            String value = raw.get(field);
            if (value == null || (NON_BLANK.contains(field) && value.isBlank())) {
                throw new MalformedGrantRecordException(field, partialTitle);
            }
        }

        return new Grant(
            raw.get(GrantField.ISSUER).trim(),
            raw.get(GrantField.TITLE).trim(),
            raw.get(GrantField.CASH_PRIZE).trim(),
            raw.get(GrantField.ENTRY_FEE).trim(),
            raw.get(GrantField.DEADLINE).trim(),
            raw.get(GrantField.GENRES).trim(),
            raw.get(GrantField.DESCRIPTION).trim(),
            GrantUrlUtils.absolutize(properties.getBaseOrigin(), raw.get(GrantField.READ_MORE_LINK)),
            normalizeText(raw.get(GrantField.EXTRA_INFO))
        );
    }

    private String normalizeText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
