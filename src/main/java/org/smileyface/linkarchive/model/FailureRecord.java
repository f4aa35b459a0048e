package org.smileyface.linkarchive.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Retry bookkeeping for one article id. Instances are immutable; the failure ledger replaces
 * them on every mutation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureRecord(String articleId,
                            String url,
                            int failureCount,
                            Instant lastFailureAt,
                            Instant cooldownUntil,
                            boolean permanent,
                            String lastError) {

    public FailureRecord {
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must be >= 0");
        }
    }

    /** Counters reset after a successful fetch; the last failure time is kept as history. */
    public FailureRecord afterSuccess() {
        return new FailureRecord(articleId, url, 0, lastFailureAt, null, false, null);
    }
}
