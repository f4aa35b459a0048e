package org.smileyface.linkarchive.ledger;

import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.PermanentFailureEntry;

import java.util.Map;

/**
 * Persistence behind the {@link FailureLedger}. Keys are article id strings.
 * Every method throws {@link org.smileyface.linkarchive.error.StorageException} when the
 * backing store is unavailable.
 */
public interface LedgerBackend {

    /** All failure records, keyed by article id. */
    Map<String, FailureRecord> loadFailures();

    /** The permanent-failure list, keyed by article id. */
    Map<String, PermanentFailureEntry> loadPermanent();

    /** Inserts or replaces the failure record of one id. */
    void saveFailure(FailureRecord record);

    /** Adds an id to the permanent-failure list; an existing entry is kept. */
    void appendPermanent(String articleId, PermanentFailureEntry entry);

    /** Removes an id from the permanent-failure list. Only used by the operator override. */
    void removePermanent(String articleId);

    /** Short name used in log lines. */
    String name();
}
