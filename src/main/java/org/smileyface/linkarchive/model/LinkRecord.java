package org.smileyface.linkarchive.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One entry of the curated link list. Immutable input to a run.
 *
 * @param url     link URL as written by the editor (not yet canonical)
 * @param title   user supplied link text, may be null
 * @param tags    user tags in declaration order
 * @param note    free-form note, may be null
 * @param section list section the link was filed under
 * @param addedAt date the link was added, null when the source does not record it
 */
public record LinkRecord(String url, String title, Set<String> tags, String note, String section,
                         LocalDate addedAt) {

    public static final String DEFAULT_SECTION = "Unsorted";

    public LinkRecord {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null/blank");
        }
        url = url.trim();
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        section = (section == null || section.isBlank()) ? DEFAULT_SECTION : section.trim();
    }

    public static LinkRecord of(String url) {
        return new LinkRecord(url, null, Set.of(), null, DEFAULT_SECTION, null);
    }

    public ArticleId articleId() {
        return ArticleId.fromUrl(url);
    }
}
