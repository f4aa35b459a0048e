package org.smileyface.linkarchive.report;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe outcome counters, updated by the scrape workers as each link is decided.
 */
public class RunReport {

    private final Map<ScrapeOutcome, AtomicInteger> counts = new EnumMap<>(ScrapeOutcome.class);
    private final AtomicInteger newlyPermanent = new AtomicInteger();
    private final AtomicInteger parsePartial = new AtomicInteger();
    private final AtomicInteger abandoned = new AtomicInteger();

    public RunReport() {
        for (ScrapeOutcome o : ScrapeOutcome.values()) {
            counts.put(o, new AtomicInteger());
        }
    }

    public void record(ScrapeOutcome outcome) {
        counts.get(Objects.requireNonNull(outcome, "outcome")).incrementAndGet();
    }

    public void recordNewlyPermanent() {
        newlyPermanent.incrementAndGet();
    }

    public void recordParsePartial() {
        parsePartial.incrementAndGet();
    }

    public void recordAbandoned(int n) {
        abandoned.addAndGet(n);
    }

    public int count(ScrapeOutcome outcome) {
        return counts.get(outcome).get();
    }

    public RunSummary summary() {
        return new RunSummary(
                count(ScrapeOutcome.SCRAPED),
                count(ScrapeOutcome.SKIPPED_CACHED),
                count(ScrapeOutcome.SKIPPED_COOLDOWN),
                count(ScrapeOutcome.SKIPPED_PERMANENT),
                count(ScrapeOutcome.FAILED),
                newlyPermanent.get(),
                parsePartial.get(),
                abandoned.get());
    }
}
