package org.smileyface.linkarchive.enrich;

import org.smileyface.linkarchive.model.ArchiveRecord;
import org.smileyface.linkarchive.model.ArticleId;

/**
 * Optional step run after a record has been committed, e.g. tagging or PDF rendering.
 * Any exception is logged by the caller and does not affect the committed record or the run.
 */
public interface RecordEnricher {

    void enrich(ArticleId articleId, ArchiveRecord record) throws Exception;

    default String name() {
        return getClass().getSimpleName();
    }
}
