package org.smileyface.linkarchive.model;

import org.smileyface.linkarchive.util.ArchiveUtils;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable identity of an archived link: the first 16 hex characters of the SHA-256 of the
 * canonical URL. Used as the archive directory name and as the failure ledger key.
 */
public final class ArticleId implements Comparable<ArticleId> {

    private static final int LENGTH = 16;
    private static final Pattern FORMAT = Pattern.compile("[0-9a-f]{" + LENGTH + "}");

    private final String value;

    private ArticleId(String value) {
        this.value = value;
    }

    /**
     * Wraps an already derived id, e.g. a directory name read back from the archive.
     *
     * @throws IllegalArgumentException if the value is not 16 lower-case hex characters
     */
    public static ArticleId of(String value) {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Not an article id: " + value);
        }
        return new ArticleId(value);
    }

    public static boolean isValid(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    /** Derives the id of a link URL; the URL is canonicalized first. */
    public static ArticleId fromUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null/blank");
        }
        String canonical = ArchiveUtils.canonicalizeUrl(url);
        return new ArticleId(ArchiveUtils.sha256Hex(canonical).substring(0, LENGTH));
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(ArticleId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((ArticleId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
