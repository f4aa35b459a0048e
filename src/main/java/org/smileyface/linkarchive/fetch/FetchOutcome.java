package org.smileyface.linkarchive.fetch;

import java.util.Objects;

/**
 * Result of one bounded fetch attempt: either a {@link FetchResult} or a classified error.
 */
public final class FetchOutcome {

    private final FetchResult result;
    private final FetchErrorKind errorKind;
    private final String errorMessage;
    private final Integer httpStatus;

    private FetchOutcome(FetchResult result, FetchErrorKind errorKind, String errorMessage, Integer httpStatus) {
        this.result = result;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.httpStatus = httpStatus;
    }

    public static FetchOutcome success(FetchResult result) {
        return new FetchOutcome(Objects.requireNonNull(result, "result"), null, null, result.httpStatus());
    }

    public static FetchOutcome failure(FetchErrorKind kind, String message, Integer httpStatus) {
        return new FetchOutcome(null, Objects.requireNonNull(kind, "kind"), message, httpStatus);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public FetchResult getResult() {
        return result;
    }

    public FetchErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    /** Text stored as the ledger's last error. */
    public String describeError() {
        return errorKind + ": " + errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchOutcome{success " + result.finalUrl() + "}" : "FetchOutcome{" + describeError() + "}";
    }
}
