package org.smileyface.linkarchive.ledger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.model.ArticleId;
import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.LedgerStatus;
import org.smileyface.linkarchive.model.PermanentFailureEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Retry bookkeeping for failed fetches.
 * <p>
 * Every failure increments the failure count of an article id and opens a cooldown window of
 * {@link #COOLDOWN}. When the count reaches {@link #MAX_FAILURES} the id becomes permanent and is
 * appended to the permanent-failure list; only {@link #clearPermanent(ArticleId)} undoes that.
 * A success resets the counters.
 * <p>
 * State is loaded from the {@link LedgerBackend} once and each mutation is written through
 * before the method returns. All mutations hold the ledger monitor, so concurrent workers
 * observe them in a total order.
 */
public class FailureLedger {

    private static final Logger log = LogManager.getLogger();

    public static final int MAX_FAILURES = 5;
    public static final Duration COOLDOWN = Duration.ofDays(7);

    private final LedgerBackend backend;
    private final Map<String, FailureRecord> records;
    private final Set<String> permanentIds;

    public FailureLedger(LedgerBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.records = new HashMap<>(backend.loadFailures());
        this.permanentIds = new TreeSet<>(backend.loadPermanent().keySet());
        reconcile();
        log.info("Failure ledger ready ({} backend): {} tracked, {} permanent",
                backend.name(), records.size(), permanentIds.size());
    }

    /**
     * The permanent-failure list is authoritative for permanence; a failure record written
     * before a crash may lag behind it, or the reverse.
     */
    private void reconcile() {
        Map<String, PermanentFailureEntry> listed = backend.loadPermanent();
        for (Map.Entry<String, PermanentFailureEntry> e : listed.entrySet()) {
            FailureRecord r = records.get(e.getKey());
            if (r == null || !r.permanent()) {
                PermanentFailureEntry p = e.getValue();
                int count = Math.max(MAX_FAILURES, Math.max(p.failureCount(), r != null ? r.failureCount() : 0));
                FailureRecord fixed = new FailureRecord(e.getKey(), p.url(), count, p.lastFailureAt(), null, true, p.lastError());
                records.put(e.getKey(), fixed);
                backend.saveFailure(fixed);
                log.warn("Restored permanent flag of {} from the permanent-failure list", e.getKey());
            }
        }
        for (FailureRecord r : records.values()) {
            if (r.permanent() && !permanentIds.contains(r.articleId())) {
                backend.appendPermanent(r.articleId(), toEntry(r));
                permanentIds.add(r.articleId());
                log.warn("Added {} to the permanent-failure list", r.articleId());
            }
        }
    }

    public synchronized LedgerStatus status(ArticleId id, Instant now) {
        if (permanentIds.contains(id.value())) {
            return LedgerStatus.permanent();
        }
        FailureRecord r = records.get(id.value());
        if (r == null || r.failureCount() == 0) {
            return LedgerStatus.neverFailed();
        }
        if (r.permanent()) {
            return LedgerStatus.permanent();
        }
        if (r.cooldownUntil() != null && now.isBefore(r.cooldownUntil())) {
            return LedgerStatus.cooling(r.cooldownUntil());
        }
        return LedgerStatus.retryable();
    }

    /**
     * Records a failed attempt.
     *
     * @return the updated record; callers compare {@code permanent()} with the previous status to
     * detect a new permanent failure
     */
    public synchronized FailureRecord recordFailure(ArticleId id, String url, Instant now, String reason) {
        Objects.requireNonNull(now, "now");
        FailureRecord prev = records.get(id.value());
        int count = (prev == null ? 0 : prev.failureCount()) + 1;
        boolean permanent = count >= MAX_FAILURES;
        FailureRecord next = new FailureRecord(id.value(), url, count, now, now.plus(COOLDOWN), permanent, reason);
        backend.saveFailure(next);
        records.put(id.value(), next);
        if (permanent && permanentIds.add(id.value())) {
            backend.appendPermanent(id.value(), toEntry(next));
            log.warn("{} marked as permanent failure after {} attempts: {}", url, count, reason);
        } else {
            log.info("Failure {} of {} for {}, cooling down until {}: {}", count, MAX_FAILURES, url, next.cooldownUntil(), reason);
        }
        return next;
    }

    public synchronized void recordSuccess(ArticleId id) {
        FailureRecord prev = records.get(id.value());
        if (prev == null || (prev.failureCount() == 0 && prev.cooldownUntil() == null)) {
            return;
        }
        if (prev.permanent()) {
            // permanent ids are never fetched; a success here means a caller bypassed the ledger
            log.warn("Ignoring success for permanent failure {}", id);
            return;
        }
        FailureRecord next = prev.afterSuccess();
        backend.saveFailure(next);
        records.put(id.value(), next);
        log.debug("Failure counters of {} reset", id);
    }

    /**
     * Operator override: forgets the permanent mark and the counters of {@code id}.
     *
     * @return true if the id was permanent
     */
    public synchronized boolean clearPermanent(ArticleId id) {
        boolean wasPermanent = permanentIds.remove(id.value());
        FailureRecord prev = records.get(id.value());
        if (prev != null) {
            FailureRecord next = prev.afterSuccess();
            backend.saveFailure(next);
            records.put(id.value(), next);
        }
        if (wasPermanent) {
            backend.removePermanent(id.value());
            log.info("Permanent failure {} cleared by operator", id);
        }
        return wasPermanent;
    }

    public synchronized Optional<FailureRecord> record(ArticleId id) {
        return Optional.ofNullable(records.get(id.value()));
    }

    public synchronized Set<String> permanentIds() {
        return Collections.unmodifiableSet(new TreeSet<>(permanentIds));
    }

    private static PermanentFailureEntry toEntry(FailureRecord r) {
        return new PermanentFailureEntry(r.url(), r.failureCount(), r.lastFailureAt(), r.lastError());
    }
}
