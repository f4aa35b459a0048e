package org.smileyface.linkarchive.processor;

import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.archive.ArchiveAssets;
import org.smileyface.linkarchive.archive.ArchiveStore;
import org.smileyface.linkarchive.enrich.RecordEnricher;
import org.smileyface.linkarchive.error.StorageException;
import org.smileyface.linkarchive.fetch.FetchOutcome;
import org.smileyface.linkarchive.fetch.FetchResult;
import org.smileyface.linkarchive.fetch.FetcherAdapter;
import org.smileyface.linkarchive.ledger.FailureLedger;
import org.smileyface.linkarchive.model.ArchiveRecord;
import org.smileyface.linkarchive.model.ArticleId;
import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.LedgerStatus;
import org.smileyface.linkarchive.model.LinkRecord;
import org.smileyface.linkarchive.report.RunReport;
import org.smileyface.linkarchive.report.RunSummary;
import org.smileyface.linkarchive.report.ScrapeOutcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one archival pass over a link list on a fixed pool of workers.
 * <p>
 * For every distinct article id the orchestrator decides (see {@link #decide}) whether to skip
 * it or fetch it; a fetched page is committed to the {@link ArchiveStore} and clears the
 * ledger's counters, a failed fetch is recorded in the {@link FailureLedger}. Per-link failures
 * never stop the run. A {@link StorageException} does: no further links are dispatched and
 * the exception is rethrown once the in-flight ones are done.
 */
public class ScrapeOrchestrator {

    private static final Logger log = LogManager.getLogger();

    private final ArchiveStore archive;
    private final FailureLedger ledger;
    private final FetcherAdapter fetcher;
    private final Clock clock;
    private final int workerCount;
    private final Duration politenessDelay;
    private final List<RecordEnricher> enrichers;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile RunState state = RunState.NEW;
    private volatile Instant startedAt;

    public ScrapeOrchestrator(ArchiveStore archive,
                              FailureLedger ledger,
                              FetcherAdapter fetcher,
                              Clock clock,
                              int workerCount,
                              Duration politenessDelay,
                              List<RecordEnricher> enrichers) {
        this.archive = Objects.requireNonNull(archive, "archive");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.workerCount = workerCount;
        this.politenessDelay = politenessDelay == null ? Duration.ZERO : politenessDelay;
        this.enrichers = enrichers == null ? List.of() : List.copyOf(enrichers);
    }

    public RunState getState() {
        return state;
    }

    /**
     * Stops dispatching. Links already being processed finish and commit; queued ones are
     * dropped and counted as abandoned. A request made while no run is active applies to the
     * next run, which then abandons every link.
     */
    @PreDestroy
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true) && state == RunState.RUNNING) {
            log.info("Cancellation requested, finishing in-flight links");
        }
    }

    /**
     * Processes {@code links} and blocks until every dispatched link is decided.
     *
     * @throws StorageException if the archive or the ledger became unusable during the run
     */
    public RunSummary run(List<LinkRecord> links, RunOptions options) {
        Objects.requireNonNull(links, "links");
        RunOptions opts = options == null ? RunOptions.defaults() : options;
        synchronized (this) {
            if (state == RunState.RUNNING) {
                throw new IllegalStateException("ScrapeOrchestrator already running");
            }
            transitionTo(RunState.RUNNING, null);
        }

        Map<ArticleId, LinkRecord> distinct = dedupe(links);
        RunReport report = new RunReport();
        AtomicReference<RuntimeException> fatal = new AtomicReference<>();
        AtomicInteger abandoned = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        List<Future<?>> futures = new ArrayList<>(distinct.size());
        try {
            for (Map.Entry<ArticleId, LinkRecord> e : distinct.entrySet()) {
                futures.add(executor.submit(() -> {
                    if (cancelRequested.get()) {
                        abandoned.incrementAndGet();
                        return;
                    }
                    try {
                        process(e.getKey(), e.getValue(), opts, report);
                    } catch (CancellationException ce) {
                        abandoned.incrementAndGet();
                    } catch (RuntimeException ex) {
                        if (fatal.compareAndSet(null, ex)) {
                            log.error("Aborting run after fatal error on {}", e.getValue().url(), ex);
                        }
                        cancelRequested.set(true);
                    }
                }));
            }
            awaitAll(futures);
        } finally {
            executor.shutdown();
        }

        report.recordAbandoned(abandoned.get());
        RunSummary summary = report.summary();
        RuntimeException error = fatal.get();
        boolean cancelled = cancelRequested.getAndSet(false);
        if (error != null) {
            transitionTo(RunState.ERROR, error);
            throw error;
        }
        transitionTo(cancelled ? RunState.CANCELLED : RunState.COMPLETED, null);
        log.info("Run summary: {} (distinct links={}, total decided={})", summary, distinct.size(), summary.total());
        return summary;
    }

    private Map<ArticleId, LinkRecord> dedupe(List<LinkRecord> links) {
        Map<ArticleId, LinkRecord> distinct = new LinkedHashMap<>();
        for (LinkRecord link : links) {
            ArticleId id = link.articleId();
            LinkRecord first = distinct.putIfAbsent(id, link);
            if (first != null) {
                log.debug("Dropping duplicate link {} (same article as {})", link.url(), first.url());
            }
        }
        if (distinct.size() < links.size()) {
            log.info("{} duplicate link(s) dropped, {} distinct", links.size() - distinct.size(), distinct.size());
        }
        return distinct;
    }

    private void awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> f : futures) {
            for (;;) {
                try {
                    f.get();
                    break;
                } catch (InterruptedException e) {
                    // keep waiting so in-flight links still commit
                    interrupted = true;
                    cancel();
                } catch (ExecutionException e) {
                    log.error("Worker task failed", e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    void process(ArticleId id, LinkRecord link, RunOptions options, RunReport report) {
        Instant now = clock.instant();
        ScrapeDecision decision = decide(id, now, options);
        log.debug("{} {} -> {}", id, link.url(), decision);
        if (!decision.isFetch()) {
            report.record(decision.getSkipOutcome());
            return;
        }
        attempt(id, link, report);
    }

    /**
     * Decides what to do with one article id:
     * <ol>
     *     <li>permanent failure: skip</li>
     *     <li>resurrected record: skip</li>
     *     <li>refresh requested and the record is missing or older than the cutoff: fetch, even while cooling down</li>
     *     <li>archived: skip</li>
     *     <li>cooling down: skip</li>
     *     <li>otherwise fetch</li>
     * </ol>
     */
    ScrapeDecision decide(ArticleId id, Instant now, RunOptions options) {
        LedgerStatus status = ledger.status(id, now);
        if (status.isPermanent()) {
            return ScrapeDecision.SKIP_PERMANENT;
        }
        Optional<ArchiveRecord> existing = archive.read(id);
        if (existing.isPresent() && existing.get().isResurrected()) {
            return ScrapeDecision.SKIP_RESURRECTED;
        }
        if (options.isRefresh()) {
            Instant lastScrapedAt = existing.map(ArchiveRecord::getScrapedAt).orElse(null);
            if (lastScrapedAt == null || lastScrapedAt.isBefore(options.refreshCutoff())) {
                return ScrapeDecision.REFRESH;
            }
        }
        if (existing.isPresent()) {
            return ScrapeDecision.SKIP_CACHED;
        }
        if (status.isCoolingAt(now)) {
            return ScrapeDecision.SKIP_COOLDOWN;
        }
        return ScrapeDecision.FETCH;
    }

    private void attempt(ArticleId id, LinkRecord link, RunReport report) {
        FetchOutcome outcome = fetcher.fetch(link.url());
        Instant at = clock.instant();
        if (outcome.isSuccess()) {
            FetchResult result = outcome.getResult();
            ArchiveRecord record = toRecord(id, link, result, at);
            archive.write(id, record, new ArchiveAssets(result.rawHtml(), result.image(), result.imageExtension(), result.pdf()));
            ledger.recordSuccess(id);
            report.record(ScrapeOutcome.SCRAPED);
            if (result.isPartial()) {
                report.recordParsePartial();
                log.info("Archived {} with {} parse warning(s)", link.url(), result.parseWarnings().size());
            }
            runEnrichers(id, record);
        } else {
            FailureRecord failure = ledger.recordFailure(id, link.url(), at, outcome.describeError());
            report.record(ScrapeOutcome.FAILED);
            if (failure.permanent()) {
                report.recordNewlyPermanent();
            }
            log.warn("Fetch of {} failed: {}", link.url(), outcome.describeError());
        }
        pause();
    }

    private ArchiveRecord toRecord(ArticleId id, LinkRecord link, FetchResult result, Instant at) {
        ArchiveRecord r = new ArchiveRecord();
        r.setArticleId(id.value());
        r.setUrl(result.finalUrl() != null ? result.finalUrl() : link.url());
        r.setOriginalUrl(link.url());
        r.setScrapedAt(at);
        r.setHttpStatus(result.httpStatus());
        r.setContentType(result.contentType());
        r.setTitle(result.title() != null ? result.title() : link.title());
        r.setBodyText(result.bodyText());
        r.setKeyImageUrl(result.keyImageUrl());
        r.setStructuredData(result.structuredData());
        r.setParseWarnings(result.parseWarnings());
        r.setTags(new ArrayList<>(link.tags()));
        r.setNote(link.note());
        r.setSection(link.section());
        return r;
    }

    private void runEnrichers(ArticleId id, ArchiveRecord record) {
        for (RecordEnricher enricher : enrichers) {
            try {
                enricher.enrich(id, record);
            } catch (Exception e) {
                log.warn("Enricher {} failed for {}: {}", enricher.name(), id, e.getMessage(), e);
            }
        }
    }

    private void pause() {
        if (politenessDelay.isZero() || cancelRequested.get()) {
            return;
        }
        try {
            Thread.sleep(politenessDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }

    private void transitionTo(RunState newState, Throwable error) {
        RunState old = this.state;
        this.state = newState;
        if (newState == RunState.RUNNING) {
            startedAt = clock.instant();
            log.info("ScrapeOrchestrator state {} -> RUNNING with {} workers", old, workerCount);
            return;
        }
        long dur = startedAt != null ? Math.max(0, Duration.between(startedAt, clock.instant()).toMillis()) : 0L;
        if (newState == RunState.ERROR) {
            log.error("ScrapeOrchestrator state {} -> ERROR after {} ms: {}", old, dur, error != null ? error.getMessage() : null);
        } else {
            log.info("ScrapeOrchestrator state {} -> {} after {} ms", old, newState, dur);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "scrape-" + seq.incrementAndGet());
        }
    }
}
