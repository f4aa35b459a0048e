package org.smileyface.linkarchive.report;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RunReportTest {

    @Test
    void summary_countsEveryOutcome() {
        RunReport report = new RunReport();
        report.record(ScrapeOutcome.SCRAPED);
        report.record(ScrapeOutcome.SCRAPED);
        report.record(ScrapeOutcome.SKIPPED_CACHED);
        report.record(ScrapeOutcome.SKIPPED_COOLDOWN);
        report.record(ScrapeOutcome.SKIPPED_PERMANENT);
        report.record(ScrapeOutcome.FAILED);
        report.recordNewlyPermanent();
        report.recordParsePartial();
        report.recordAbandoned(3);

        RunSummary s = report.summary();

        assertThat(s).isEqualTo(new RunSummary(2, 1, 1, 1, 1, 1, 1, 3));
        assertThat(s.total()).as("flags and abandoned links are not decisions").isEqualTo(6);
        assertThat(s.toString()).isEqualTo("scraped=2, skipped_cached=1, skipped_cooldown=1, skipped_permanent=1, "
                + "failed=1, newly_permanent=1, parse_partial=1, abandoned=3");
    }

    @Test
    void record_isSafeAcrossThreads() throws InterruptedException {
        RunReport report = new RunReport();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            Thread th = new Thread(() -> {
                for (int i = 0; i < 1000; i++) report.record(ScrapeOutcome.SCRAPED);
            });
            threads.add(th);
            th.start();
        }
        for (Thread th : threads) th.join();

        assertThat(report.count(ScrapeOutcome.SCRAPED)).isEqualTo(8000);
    }

    @Test
    void record_rejectsNull() {
        assertThatThrownBy(() -> new RunReport().record(null)).isInstanceOf(NullPointerException.class);
    }
}
