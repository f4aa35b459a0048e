package org.smileyface.linkarchive.report;

/**
 * What happened to one link in a run.
 */
public enum ScrapeOutcome {
    SCRAPED,
    SKIPPED_CACHED,
    SKIPPED_COOLDOWN,
    SKIPPED_PERMANENT,
    FAILED
}
