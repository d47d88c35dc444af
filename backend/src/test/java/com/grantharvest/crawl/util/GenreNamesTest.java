package com.grantharvest.crawl.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GenreNamesTest {

    @Test
    void collapsesEmptyAndRepeatedPieces() {
        Set<String> names = GenreNames.split("Fiction, , Poetry,Fiction");
        assertThat(names).containsExactly("Fiction", "Poetry");
    }

    @Test
    void keepsCaseDistinctNames() {
        assertThat(List.copyOf(GenreNames.split("poetry, Poetry"))).containsExactly("poetry", "Poetry");
    }

    @Test
    void blankInputHasNoGenres() {
        assertThat(GenreNames.split("")).isEmpty();
        assertThat(GenreNames.split(" , ,")).isEmpty();
        assertThat(GenreNames.split(null)).isEmpty();
    }
}
