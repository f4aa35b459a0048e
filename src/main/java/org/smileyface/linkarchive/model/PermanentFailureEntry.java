package org.smileyface.linkarchive.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Entry of the append-only permanent-failure list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermanentFailureEntry(String url, int failureCount, Instant lastFailureAt, String lastError) {
}
