package org.smileyface.linkarchive.ledger;

import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.PermanentFailureEntry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, non-persistent ledger backend. Intended for tests and dry runs.
 */
public class InMemoryLedgerBackend implements LedgerBackend {

    private final Map<String, FailureRecord> failures = new ConcurrentHashMap<>();
    private final Map<String, PermanentFailureEntry> permanent = new ConcurrentHashMap<>();

    @Override
    public Map<String, FailureRecord> loadFailures() {
        return new LinkedHashMap<>(failures);
    }

    @Override
    public Map<String, PermanentFailureEntry> loadPermanent() {
        return new LinkedHashMap<>(permanent);
    }

    @Override
    public void saveFailure(FailureRecord record) {
        failures.put(record.articleId(), record);
    }

    @Override
    public void appendPermanent(String articleId, PermanentFailureEntry entry) {
        permanent.putIfAbsent(articleId, entry);
    }

    @Override
    public void removePermanent(String articleId) {
        permanent.remove(articleId);
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
