package org.smileyface.linkarchive.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link ContentFetcher} under a deadline and turns every way it can end into a
 * {@link FetchOutcome}. Checked fetch errors keep their kind, other exceptions are classified
 * with {@link FetchErrorKind#fromException(Throwable)}, and a call that overruns the deadline
 * is cancelled and reported as {@link FetchErrorKind#TIMEOUT}.
 * <p>
 * Once {@link #close()} has been called, a fetch that is still running or is started later ends
 * with a {@link CancellationException} instead of an outcome: an error caused by the shutdown
 * says nothing about the URL and must not reach the failure ledger.
 */
public class FetcherAdapter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetcherAdapter.class);

    private final ContentFetcher fetcher;
    private final Duration timeout;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FetcherAdapter(ContentFetcher fetcher, Duration timeout) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.executor = Executors.newCachedThreadPool(new FetchThreadFactory());
    }

    /**
     * Fetches {@code url}, waiting at most the configured timeout.
     *
     * @throws CancellationException if the calling thread is interrupted while waiting, or the
     *                               adapter is closed before the fetch produced a result
     */
    public FetchOutcome fetch(String url) {
        if (closed.get()) {
            throw new CancellationException("Fetcher closed, " + url + " not fetched");
        }
        Future<FetchResult> future;
        try {
            future = executor.submit(() -> fetcher.fetch(url));
        } catch (RejectedExecutionException e) {
            CancellationException ce = new CancellationException("Fetcher closed, " + url + " not fetched");
            ce.initCause(e);
            throw ce;
        }
        try {
            FetchResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return FetchOutcome.failure(FetchErrorKind.UNKNOWN, "fetcher returned no result", null);
            }
            return FetchOutcome.success(result);
        } catch (TimeoutException e) {
            future.cancel(true);
            abandonIfClosed(url, e);
            log.debug("Fetch of {} timed out after {} ms", url, timeout.toMillis());
            return FetchOutcome.failure(FetchErrorKind.TIMEOUT, "no response within " + timeout.toMillis() + " ms", null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            abandonIfClosed(url, cause);
            if (cause instanceof FetchException fe) {
                return FetchOutcome.failure(fe.getKind(), fe.getMessage(), fe.getHttpStatus());
            }
            FetchErrorKind kind = FetchErrorKind.fromException(cause);
            if (kind == FetchErrorKind.UNKNOWN) {
                log.warn("Unexpected error fetching {}", url, cause);
            }
            return FetchOutcome.failure(kind, String.valueOf(cause.getMessage()), null);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException ce = new CancellationException("Fetch of " + url + " interrupted");
            ce.initCause(e);
            throw ce;
        }
    }

    private void abandonIfClosed(String url, Throwable cause) {
        if (closed.get()) {
            log.debug("Fetch of {} abandoned on close: {}", url, cause.toString());
            CancellationException ce = new CancellationException("Fetch of " + url + " abandoned, fetcher closed");
            ce.initCause(cause);
            throw ce;
        }
    }

    /**
     * Interrupts running fetches; they end with a {@link CancellationException} in their callers.
     */
    @Override
    public void close() {
        closed.set(true);
        executor.shutdownNow();
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
