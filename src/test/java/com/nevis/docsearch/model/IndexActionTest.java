package com.nevis.docsearch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndexActionTest {

    @Test
    @DisplayName("Wire values should be case-insensitive and unknown values null")
    void shouldParseWireValues() {
        assertThat(IndexAction.fromWire("index")).isEqualTo(IndexAction.INDEX);
        assertThat(IndexAction.fromWire("DELETE")).isEqualTo(IndexAction.DELETE);
        assertThat(IndexAction.fromWire("reindex")).isNull();
        assertThat(IndexAction.fromWire(null)).isNull();
    }

    @Test
    @DisplayName("Each action should map to its topic and dead-letter kind")
    void shouldMapTopicsAndJobKinds() {
        assertThat(IndexAction.fromTopic("document.index")).isEqualTo(IndexAction.INDEX);
        assertThat(IndexAction.fromTopic("document.delete")).isEqualTo(IndexAction.DELETE);
        assertThat(IndexAction.fromTopic("other")).isNull();
        assertThat(IndexAction.INDEX.jobKind()).isEqualTo("indexing");
        assertThat(IndexAction.DELETE.jobKind()).isEqualTo("deletion");
    }
}
