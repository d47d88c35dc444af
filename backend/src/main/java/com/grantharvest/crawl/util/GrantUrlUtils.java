package com.grantharvest.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;

public final class GrantUrlUtils {

    private GrantUrlUtils() {
    }

    /**
     * Resolves a listing link against the site's origin. Links that already carry a scheme are
     * returned trimmed; blank links yield null.
     */
    public static String absolutize(String baseOrigin, String link) {
        if (link == null || link.isBlank()) {
            return null;
        }
        String trimmed = link.trim();
        URI uri = safeUri(trimmed);
        if (uri != null && uri.isAbsolute()) {
            return trimmed;
        }
        if (trimmed.startsWith("//")) {
            String scheme = schemeOf(baseOrigin);
            return (scheme == null ? "https" : scheme) + ":" + trimmed;
        }
        String origin = stripTrailingSlashes(baseOrigin);
        if (origin.isEmpty()) {
            return trimmed;
        }
        return trimmed.startsWith("/") ? origin + trimmed : origin + "/" + trimmed;
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String schemeOf(String baseOrigin) {
        URI origin = baseOrigin == null ? null : safeUri(baseOrigin.trim());
        return origin == null ? null : origin.getScheme();
    }

    private static String stripTrailingSlashes(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
