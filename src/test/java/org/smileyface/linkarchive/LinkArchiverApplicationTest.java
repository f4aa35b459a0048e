package org.smileyface.linkarchive;

import org.junit.jupiter.api.Test;
import org.smileyface.linkarchive.archive.ArchiveStore;
import org.smileyface.linkarchive.cli.ArchiveCliRunner;
import org.smileyface.linkarchive.config.ArchiverProperties;
import org.smileyface.linkarchive.enrich.RecordEnricher;
import org.smileyface.linkarchive.ledger.FailureLedger;
import org.smileyface.linkarchive.ledger.InMemoryLedgerBackend;
import org.smileyface.linkarchive.ledger.LedgerBackend;
import org.smileyface.linkarchive.model.ArchiveRecord;
import org.smileyface.linkarchive.model.ArticleId;
import org.smileyface.linkarchive.processor.RunState;
import org.smileyface.linkarchive.processor.ScrapeOrchestrator;
import org.smileyface.linkarchive.testutil.ScriptedFetcher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class LinkArchiverApplicationTest {

    @Autowired
    private ArchiverProperties properties;

    @Autowired
    private LedgerBackend ledgerBackend;

    @Autowired
    private FailureLedger failureLedger;

    @Autowired
    private ArchiveStore archiveStore;

    @Autowired
    private ScrapeOrchestrator orchestrator;

    @Autowired
    private ArchiveCliRunner runner;

    @Autowired
    private ScriptedFetcher fetcher;

    @Autowired
    private RecordingEnricher enricher;

    @TestConfiguration
    static class TestBeans {
        @Bean
        @Primary
        public ScriptedFetcher scriptedFetcher() {
            return new ScriptedFetcher();
        }

        @Bean
        public RecordingEnricher recordingEnricher() {
            return new RecordingEnricher();
        }
    }

    static class RecordingEnricher implements RecordEnricher {
        final List<ArticleId> seen = new CopyOnWriteArrayList<>();

        @Override
        public void enrich(ArticleId articleId, ArchiveRecord record) {
            seen.add(articleId);
        }
    }

    @Test
    void contextLoads_withTestProfile() {
        assertThat(properties.getLedger().getType()).isEqualTo("in-memory");
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(ledgerBackend).isInstanceOf(InMemoryLedgerBackend.class);
        assertThat(orchestrator.getState()).isIn(RunState.NEW, RunState.COMPLETED);
    }

    @Test
    void execute_archivesLinksFromMarkdownFile() throws IOException {
        String url = "https://example.com/" + UUID.randomUUID();
        String broken = "https://example.com/broken-" + UUID.randomUUID();
        fetcher.failFor(broken);
        Path links = Path.of(properties.getLinksFile());
        Files.createDirectories(links.getParent());
        Files.writeString(links, "## Reading\n- [Some page](" + url + ") #test @note:from the context test\n- " + broken + "\n");

        int code = runner.execute(new DefaultApplicationArguments());

        assertThat(code).isEqualTo(ArchiveCliRunner.EXIT_OK);
        ArticleId id = ArticleId.fromUrl(url);
        ArchiveRecord record = archiveStore.read(id).orElseThrow();
        assertThat(record.getTitle()).isEqualTo("Title of " + url);
        assertThat(record.getSection()).isEqualTo("Reading");
        assertThat(record.getTags()).containsExactly("test");
        assertThat(record.getNote()).isEqualTo("from the context test");
        assertThat(failureLedger.record(ArticleId.fromUrl(broken))).isPresent();
        assertThat(enricher.seen).contains(id);
        assertThat(orchestrator.getState()).isEqualTo(RunState.COMPLETED);
    }

    @Test
    void execute_badCutoffIsConfigurationExitCode() {
        assertThat(runner.execute(new DefaultApplicationArguments("--refresh-older-than=yesterday")))
                .isEqualTo(ArchiveCliRunner.EXIT_CONFIGURATION);
    }
}
