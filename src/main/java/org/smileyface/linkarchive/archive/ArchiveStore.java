package org.smileyface.linkarchive.archive;

import org.smileyface.linkarchive.model.ArchiveRecord;
import org.smileyface.linkarchive.model.ArticleId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of archived links, one entry per {@link ArticleId}.
 * <p>
 * Implementations must be safe for concurrent use by the scrape workers and must never expose a
 * partially written entry: a reader sees either the previous complete record or the new one.
 * All methods throw {@link org.smileyface.linkarchive.error.StorageException} when the
 * underlying storage cannot be accessed.
 */
public interface ArchiveStore {

    /**
     * @return true if a committed entry with a readable metadata document exists
     */
    boolean exists(ArticleId articleId);

    /**
     * @return the committed record, or empty if there is none (or its metadata is unreadable)
     */
    Optional<ArchiveRecord> read(ArticleId articleId);

    /**
     * Persists the record together with its assets, replacing any previous entry in one
     * atomic step. The asset references on {@code record} are set by the store.
     */
    void write(ArticleId articleId, ArchiveRecord record, ArchiveAssets assets);

    /**
     * @return the scrape time of the committed record, empty if not archived
     */
    default Optional<Instant> lastScrapedAt(ArticleId articleId) {
        return read(articleId).map(ArchiveRecord::getScrapedAt);
    }

    /**
     * @return ids of all committed entries, sorted
     */
    List<ArticleId> list();
}
