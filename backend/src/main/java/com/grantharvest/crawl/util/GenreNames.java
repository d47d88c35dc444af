package com.grantharvest.crawl.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

public final class GenreNames {

    private GenreNames() {
    }

    // Order of first appearance is kept; empty pieces and repeats collapse.
    public static Set<String> split(String rawGenres) {
        Set<String> names = new LinkedHashSet<>();
        if (rawGenres == null || rawGenres.isBlank()) {
            return names;
        }
        Arrays.stream(rawGenres.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(names::add);
        return names;
    }
}
