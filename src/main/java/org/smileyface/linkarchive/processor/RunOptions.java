package org.smileyface.linkarchive.processor;

import java.time.Instant;

/**
 * Per-run switches.
 *
 * @param refreshCutoff records scraped before this instant are fetched again; null disables refresh
 */
public record RunOptions(Instant refreshCutoff) {

    private static final RunOptions DEFAULT = new RunOptions(null);

    public static RunOptions defaults() {
        return DEFAULT;
    }

    public static RunOptions refreshOlderThan(Instant cutoff) {
        return new RunOptions(cutoff);
    }

    public boolean isRefresh() {
        return refreshCutoff != null;
    }
}
