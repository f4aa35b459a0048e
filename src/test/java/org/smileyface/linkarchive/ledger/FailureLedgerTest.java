package org.smileyface.linkarchive.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.linkarchive.model.ArticleId;
import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.LedgerStatus;
import org.smileyface.linkarchive.model.PermanentFailureEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class FailureLedgerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final String URL = "https://example.com/flaky";

    private InMemoryLedgerBackend backend;
    private FailureLedger ledger;
    private ArticleId id;

    @BeforeEach
    void setUp() {
        backend = new InMemoryLedgerBackend();
        ledger = new FailureLedger(backend);
        id = ArticleId.fromUrl(URL);
    }

    @Test
    void unknownId_neverFailed() {
        assertThat(ledger.status(id, T0).kind()).isEqualTo(LedgerStatus.Kind.NEVER_FAILED);
        assertThat(ledger.record(id)).isEmpty();
    }

    @Test
    void recordFailure_opensSevenDayCooldown() {
        FailureRecord r = ledger.recordFailure(id, URL, T0, "TIMEOUT: no response");

        assertThat(r.failureCount()).isEqualTo(1);
        assertThat(r.lastFailureAt()).isEqualTo(T0);
        assertThat(r.cooldownUntil()).isEqualTo(T0.plus(Duration.ofDays(7)));
        assertThat(r.permanent()).isFalse();
        assertThat(r.lastError()).isEqualTo("TIMEOUT: no response");

        LedgerStatus during = ledger.status(id, T0.plus(Duration.ofDays(6)));
        assertThat(during.kind()).isEqualTo(LedgerStatus.Kind.COOLING);
        assertThat(during.until()).isEqualTo(T0.plus(FailureLedger.COOLDOWN));
        assertThat(ledger.status(id, T0.plus(Duration.ofDays(7))).kind())
                .as("cooldown ends exactly at cooldownUntil")
                .isEqualTo(LedgerStatus.Kind.RETRYABLE);
    }

    @Test
    void fifthFailure_isPermanent_andListed() {
        FailureRecord last = null;
        for (int i = 0; i < FailureLedger.MAX_FAILURES; i++) {
            last = ledger.recordFailure(id, URL, T0.plus(Duration.ofDays(8L * i)), "HTTP 500");
            if (i < FailureLedger.MAX_FAILURES - 1) {
                assertThat(last.permanent()).as("after %d failures", i + 1).isFalse();
            }
        }
        assertThat(last.failureCount()).isEqualTo(5);
        assertThat(last.permanent()).isTrue();
        assertThat(ledger.status(id, T0.plus(Duration.ofDays(365))).isPermanent()).isTrue();
        assertThat(ledger.permanentIds()).containsExactly(id.value());
        assertThat(backend.loadPermanent()).containsKey(id.value());
        assertThat(backend.loadPermanent().get(id.value()).failureCount()).isEqualTo(5);
    }

    @Test
    void recordSuccess_resetsCounters() {
        ledger.recordFailure(id, URL, T0, "HTTP 503");
        ledger.recordFailure(id, URL, T0.plus(Duration.ofDays(8)), "HTTP 503");

        ledger.recordSuccess(id);

        FailureRecord r = ledger.record(id).orElseThrow();
        assertThat(r.failureCount()).isZero();
        assertThat(r.cooldownUntil()).isNull();
        assertThat(r.permanent()).isFalse();
        assertThat(ledger.status(id, T0.plus(Duration.ofDays(9))).kind()).isEqualTo(LedgerStatus.Kind.NEVER_FAILED);
        assertThat(backend.loadFailures().get(id.value()).failureCount()).isZero();
    }

    @Test
    void recordSuccess_forUnknownId_writesNothing() {
        ledger.recordSuccess(id);
        assertThat(backend.loadFailures()).isEmpty();
    }

    @Test
    void permanentIsTerminal_untilCleared() {
        for (int i = 0; i < FailureLedger.MAX_FAILURES; i++) {
            ledger.recordFailure(id, URL, T0, "HTTP 404");
        }
        ledger.recordSuccess(id);
        assertThat(ledger.status(id, T0).isPermanent()).as("success does not clear a permanent mark").isTrue();

        assertThat(ledger.clearPermanent(id)).isTrue();

        assertThat(ledger.status(id, T0).kind()).isEqualTo(LedgerStatus.Kind.NEVER_FAILED);
        assertThat(ledger.permanentIds()).isEmpty();
        assertThat(backend.loadPermanent()).isEmpty();
        assertThat(ledger.clearPermanent(id)).isFalse();
    }

    @Test
    void construction_reconcilesPermanentListWithFailureRecords() {
        InMemoryLedgerBackend seeded = new InMemoryLedgerBackend();
        // listed as permanent but the failure record lags behind
        seeded.saveFailure(new FailureRecord(id.value(), URL, 4, T0, T0.plus(FailureLedger.COOLDOWN), false, "HTTP 500"));
        seeded.appendPermanent(id.value(), new PermanentFailureEntry(URL, 5, T0, "HTTP 500"));
        // permanent record missing from the list
        ArticleId other = ArticleId.fromUrl("https://example.com/other");
        seeded.saveFailure(new FailureRecord(other.value(), "https://example.com/other", 5, T0, null, true, "HTTP 410"));

        FailureLedger reloaded = new FailureLedger(seeded);

        assertThat(reloaded.status(id, T0).isPermanent()).isTrue();
        assertThat(reloaded.record(id).orElseThrow().failureCount()).isEqualTo(5);
        assertThat(reloaded.record(id).orElseThrow().permanent()).isTrue();
        assertThat(reloaded.permanentIds()).containsExactlyInAnyOrder(id.value(), other.value());
        assertThat(seeded.loadPermanent()).containsKey(other.value());
    }

    @Test
    void concurrentFailures_areAllCounted() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> ledger.recordFailure(id, URL, T0, "HTTP 502")));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdown();
        }
        assertThat(ledger.record(id).orElseThrow().failureCount()).isEqualTo(4);
    }
}
