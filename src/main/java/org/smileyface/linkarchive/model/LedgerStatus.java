package org.smileyface.linkarchive.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Retry state of an article id as seen by the failure ledger at a given instant.
 *
 * @param kind  the state
 * @param until end of the cooldown window; only set for {@link Kind#COOLING}
 */
public record LedgerStatus(Kind kind, Instant until) {

    public enum Kind {
        /** No failure on record, or the counters were reset by a success. */
        NEVER_FAILED,

        /** Failed recently; automatic retries are suppressed until the cooldown ends. */
        COOLING,

        /** Failed before, cooldown over. */
        RETRYABLE,

        /** Reached the failure limit. Terminal until an operator clears it. */
        PERMANENT
    }

    private static final LedgerStatus NEVER_FAILED = new LedgerStatus(Kind.NEVER_FAILED, null);
    private static final LedgerStatus RETRYABLE = new LedgerStatus(Kind.RETRYABLE, null);
    private static final LedgerStatus PERMANENT = new LedgerStatus(Kind.PERMANENT, null);

    public LedgerStatus {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.COOLING && until == null) {
            throw new IllegalArgumentException("COOLING requires an end instant");
        }
    }

    public static LedgerStatus neverFailed() { return NEVER_FAILED; }
    public static LedgerStatus retryable() { return RETRYABLE; }
    public static LedgerStatus permanent() { return PERMANENT; }
    public static LedgerStatus cooling(Instant until) { return new LedgerStatus(Kind.COOLING, until); }

    public boolean isPermanent() {
        return kind == Kind.PERMANENT;
    }

    /** True while the cooldown window is still open at {@code now}. */
    public boolean isCoolingAt(Instant now) {
        return kind == Kind.COOLING && now.isBefore(until);
    }
}
