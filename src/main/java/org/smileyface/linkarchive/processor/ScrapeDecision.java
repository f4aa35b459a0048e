package org.smileyface.linkarchive.processor;

import org.smileyface.linkarchive.report.ScrapeOutcome;

/**
 * Per-link decision taken before any network access, in priority order.
 */
public enum ScrapeDecision {
    /** Permanent failure; not even a refresh retries it. */
    SKIP_PERMANENT(ScrapeOutcome.SKIPPED_PERMANENT),
    /** Archived by the dead-link recovery path; never overwritten. */
    SKIP_RESURRECTED(ScrapeOutcome.SKIPPED_CACHED),
    /** Archived before the refresh cutoff, or never archived during a refresh run. Ignores cooldown. */
    REFRESH(null),
    SKIP_CACHED(ScrapeOutcome.SKIPPED_CACHED),
    SKIP_COOLDOWN(ScrapeOutcome.SKIPPED_COOLDOWN),
    FETCH(null);

    private final ScrapeOutcome skipOutcome;

    ScrapeDecision(ScrapeOutcome skipOutcome) {
        this.skipOutcome = skipOutcome;
    }

    public boolean isFetch() {
        return skipOutcome == null;
    }

    /** Outcome reported for a skip; null for decisions that fetch. */
    public ScrapeOutcome getSkipOutcome() {
        return skipOutcome;
    }
}
