package com.nevis.docsearch.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SearchPagingTest {

    @Test
    @DisplayName("Missing values should fall back to page 1 and the default page size")
    void shouldApplyDefaults() {
        assertThat(SearchPaging.of(null, null, 20, 100)).isEqualTo(new SearchPaging(1, 20));
    }

    @Test
    @DisplayName("Out-of-range values should be clamped")
    void shouldClamp() {
        assertThat(SearchPaging.of(0, 500, 20, 100)).isEqualTo(new SearchPaging(1, 100));
        assertThat(SearchPaging.of(-3, 0, 20, 100)).isEqualTo(new SearchPaging(1, 20));
    }

    @Test
    @DisplayName("Offset should skip the previous pages")
    void shouldComputeOffset() {
        assertThat(new SearchPaging(3, 10).offset()).isEqualTo(20);
        assertThat(new SearchPaging(Integer.MAX_VALUE, 100).offset()).isEqualTo(Integer.MAX_VALUE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"abc", "1.5", "99999999999"})
    @DisplayName("Unparsable parameters should become null")
    void shouldParseLeniently(String raw) {
        assertThat(SearchPaging.parse(raw)).isNull();
    }

    @Test
    @DisplayName("Non-numeric page should resolve to page 1")
    void shouldResolveNonNumericPage() {
        assertThat(SearchPaging.of(SearchPaging.parse("abc"), SearchPaging.parse(" 30 "), 20, 100))
            .isEqualTo(new SearchPaging(1, 30));
    }
}
