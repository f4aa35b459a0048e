package org.smileyface.linkarchive.fetch;

import org.jsoup.HttpStatusException;
import org.jsoup.UnsupportedMimeTypeException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

/**
 * Classification of a failed fetch. Every kind is recorded in the failure ledger; the kind
 * only changes what is logged and stored as the last error.
 */
public enum FetchErrorKind {
    /** No response within the per-URL deadline. */
    TIMEOUT,
    /** DNS, connection reset, TLS and similar I/O problems. */
    TRANSIENT_NETWORK,
    /** The server answered with an HTTP error status or with content that cannot be archived. */
    REMOTE_REJECTION,
    /** Anything else thrown by a fetcher. */
    UNKNOWN;

    public static FetchErrorKind fromException(Throwable t) {
        if (t instanceof FetchException fe) {
            return fe.getKind();
        }
        if (t instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (t instanceof HttpStatusException || t instanceof UnsupportedMimeTypeException) {
            return REMOTE_REJECTION;
        }
        if (t instanceof InterruptedIOException) {
            return TIMEOUT;
        }
        if (t instanceof IOException) {
            return TRANSIENT_NETWORK;
        }
        return UNKNOWN;
    }
}
