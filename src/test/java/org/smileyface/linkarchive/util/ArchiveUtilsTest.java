package org.smileyface.linkarchive.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ArchiveUtilsTest {

    @Test
    void canonicalizeUrl_lowercasesSchemeAndHost_keepsPathCase() {
        assertThat(ArchiveUtils.canonicalizeUrl("HTTPS://Example.COM/Some/Path"))
                .isEqualTo("https://example.com/Some/Path");
    }

    @Test
    void canonicalizeUrl_addsRootPath() {
        assertThat(ArchiveUtils.canonicalizeUrl("https://example.com")).isEqualTo("https://example.com/");
    }

    @Test
    void canonicalizeUrl_stripsTrackingParams_keepsOthersInOrder() {
        assertThat(ArchiveUtils.canonicalizeUrl("https://example.com/p?b=2&utm_source=news&a=1&utm_term=x"))
                .isEqualTo("https://example.com/p?b=2&a=1");
        assertThat(ArchiveUtils.canonicalizeUrl("https://example.com/p?utm_medium=mail"))
                .isEqualTo("https://example.com/p");
    }

    @Test
    void canonicalizeUrl_keepsFragmentAndPort() {
        assertThat(ArchiveUtils.canonicalizeUrl("http://localhost:8080/a#top"))
                .isEqualTo("http://localhost:8080/a#top");
        assertThat(ArchiveUtils.canonicalizeUrl("https://example.com/p?utm_source=x&id=7#c2"))
                .isEqualTo("https://example.com/p?id=7#c2");
    }

    @Test
    void canonicalizeUrl_unparseableInputIsReturnedTrimmed() {
        assertThat(ArchiveUtils.canonicalizeUrl("  not a url  ")).isEqualTo("not a url");
        assertThat(ArchiveUtils.canonicalizeUrl("mailto:someone@example.com")).isEqualTo("mailto:someone@example.com");
    }

    @Test
    void sha256Hex_knownVector() {
        assertThat(ArchiveUtils.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(ArchiveUtils.sha256Hex(null)).isEqualTo(ArchiveUtils.sha256Hex(""));
    }

    @Test
    void truncate_cutsOnlyLongValues() {
        assertThat(ArchiveUtils.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(ArchiveUtils.truncate("ab", 3)).isEqualTo("ab");
        assertThat(ArchiveUtils.truncate(null, 3)).isNull();
    }
}
