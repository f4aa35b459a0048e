package org.smileyface.linkarchive.testutil;

import org.smileyface.linkarchive.fetch.ContentFetcher;
import org.smileyface.linkarchive.fetch.FetchErrorKind;
import org.smileyface.linkarchive.fetch.FetchException;
import org.smileyface.linkarchive.fetch.FetchResult;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ContentFetcher whose answer per URL is set by the test. URLs without a script succeed
 * with a small page. Every call is recorded.
 */
public class ScriptedFetcher implements ContentFetcher {

    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Map<String, FetchResult> results = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMs;

    public ScriptedFetcher failFor(String url) {
        failing.add(url);
        return this;
    }

    public ScriptedFetcher succeedFor(String url) {
        failing.remove(url);
        return this;
    }

    public ScriptedFetcher resultFor(String url, FetchResult result) {
        results.put(url, result);
        return this;
    }

    public ScriptedFetcher delay(long ms) {
        this.delayMs = ms;
        return this;
    }

    @Override
    public FetchResult fetch(String url) throws FetchException {
        calls.add(url);
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchException(FetchErrorKind.TIMEOUT, "interrupted");
                }
            }
            if (failing.contains(url)) {
                throw new FetchException(FetchErrorKind.REMOTE_REJECTION, "HTTP 503 Service Unavailable", 503);
            }
            FetchResult r = results.get(url);
            if (r != null) {
                return r;
            }
            return FetchResult.of(url, "Title of " + url, "Body of " + url, "<html><body>" + url + "</body></html>");
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public List<String> calls() {
        return calls;
    }

    public long callsFor(String url) {
        return calls.stream().filter(url::equals).count();
    }

    public int maxConcurrent() {
        return maxInFlight.get();
    }

    public void reset() {
        calls.clear();
    }
}
