package org.smileyface.linkarchive.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class LinkRecordTest {

    @Test
    void blankSectionDefaultsToUnsorted() {
        LinkRecord r = new LinkRecord(" https://example.com/ ", null, null, null, " ", null);
        assertThat(r.section()).isEqualTo(LinkRecord.DEFAULT_SECTION);
        assertThat(r.url()).isEqualTo("https://example.com/");
        assertThat(r.tags()).isEmpty();
    }

    @Test
    void tagsKeepOrderAndAreUnmodifiable() {
        Set<String> tags = new LinkedHashSet<>(List.of("b", "a"));
        LinkRecord r = new LinkRecord("https://example.com/", "t", tags, null, "2024", null);
        assertThat(r.tags()).containsExactly("b", "a");
        assertThatThrownBy(() -> r.tags().add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void blankUrlIsRejected() {
        assertThatThrownBy(() -> LinkRecord.of("")).isInstanceOf(IllegalArgumentException.class);
    }
}
