package org.smileyface.linkarchive.fetch;

import java.util.Objects;

/**
 * Failed fetch of one URL. Never fatal for the run: the orchestrator records it in the failure
 * ledger and moves on.
 */
public class FetchException extends Exception {

    private final FetchErrorKind kind;
    private final Integer httpStatus;

    public FetchException(FetchErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public FetchException(FetchErrorKind kind, String message, Integer httpStatus) {
        this(kind, message, httpStatus, null);
    }

    public FetchException(FetchErrorKind kind, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.httpStatus = httpStatus;
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    /** HTTP status of a rejection, null when no response was received. */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
