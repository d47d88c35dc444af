package com.grantharvest.crawl.model;

import java.util.Objects;

/**
 * Canonical grant ready for storage. {@code readMoreLink} and {@code extraInfo} may be null; every
 * other component is non-null.
 */
public record Grant(
    String issuer,
    String title,
    String cashPrize,
    String entryFee,
    String deadline,
    String genres,
    String description,
    String readMoreLink,
    String extraInfo
) {
    public Grant {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(cashPrize, "cashPrize");
        Objects.requireNonNull(entryFee, "entryFee");
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(genres, "genres");
        Objects.requireNonNull(description, "description");
    }

    public GrantKey naturalKey() {
        return new GrantKey(issuer, title, deadline);
    }

    public boolean hasExtraInfo() {
        return extraInfo != null && !extraInfo.isBlank();
    }
}
