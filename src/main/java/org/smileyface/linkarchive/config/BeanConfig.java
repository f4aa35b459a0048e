package org.smileyface.linkarchive.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.archive.ArchiveStore;
import org.smileyface.linkarchive.archive.FileSystemArchiveStore;
import org.smileyface.linkarchive.enrich.RecordEnricher;
import org.smileyface.linkarchive.extractor.PageMetadataExtractor;
import org.smileyface.linkarchive.fetch.ContentFetcher;
import org.smileyface.linkarchive.fetch.FetcherAdapter;
import org.smileyface.linkarchive.fetch.JsoupContentFetcher;
import org.smileyface.linkarchive.ledger.FailureLedger;
import org.smileyface.linkarchive.ledger.FileLedgerBackend;
import org.smileyface.linkarchive.ledger.InMemoryLedgerBackend;
import org.smileyface.linkarchive.ledger.LedgerBackend;
import org.smileyface.linkarchive.ledger.RedisLedgerBackend;
import org.smileyface.linkarchive.link.LinkSource;
import org.smileyface.linkarchive.link.MarkdownLinkSource;
import org.smileyface.linkarchive.processor.ScrapeOrchestrator;
import org.smileyface.linkarchive.util.JsonSupport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the archiver from {@link ArchiverProperties}. The properties are validated once, before
 * any bean below is created.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger();

    private final ArchiverProperties properties;

    public BeanConfig(ArchiverProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonSupport.newMapper();
    }

    @Bean
    public ArchiveStore archiveStore(ObjectMapper objectMapper) {
        return new FileSystemArchiveStore(Path.of(properties.getArchiveDir()), objectMapper);
    }

    /**
     * Selects the ledger backend from {@code archiver.ledger.type}:
     * - "file" (default): {@link FileLedgerBackend} in {@code archiver.ledger.dir}
     * - "in-memory": {@link InMemoryLedgerBackend}, nothing survives the run
     * - "redis": {@link RedisLedgerBackend} when a {@link StringRedisTemplate} is available;
     *   falls back to the file backend otherwise.
     */
    @Bean
    public LedgerBackend ledgerBackend(ObjectProvider<StringRedisTemplate> redisProvider, ObjectMapper objectMapper) {
        String kind = properties.getLedger().getType();
        if ("in-memory".equals(kind)) {
            return new InMemoryLedgerBackend();
        }
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                return new RedisLedgerBackend(template, objectMapper, properties.getLedger().getNamespace());
            }
            log.warn("Redis ledger requested but no Redis connection is configured, using the file ledger");
        }
        return new FileLedgerBackend(Path.of(properties.getLedger().getDir()), objectMapper);
    }

    @Bean
    public FailureLedger failureLedger(LedgerBackend ledgerBackend) {
        return new FailureLedger(ledgerBackend);
    }

    @Bean
    public ContentFetcher contentFetcher(ObjectMapper objectMapper) {
        PageMetadataExtractor extractor = new PageMetadataExtractor(
                properties.buildContentExtractor(), objectMapper, properties.getMaxTextChars());
        return new JsoupContentFetcher(extractor, properties.getUserAgent(), properties.getRequestTimeoutMs(),
                properties.getImageTimeoutMs(), properties.getMaxImageBytes(), properties.getMaxHtmlChars());
    }

    @Bean
    public FetcherAdapter fetcherAdapter(ContentFetcher contentFetcher) {
        return new FetcherAdapter(contentFetcher, Duration.ofMillis(properties.getFetchTimeoutMs()));
    }

    @Bean
    public LinkSource linkSource() {
        return new MarkdownLinkSource(Path.of(properties.getLinksFile()));
    }

    @Bean
    public ScrapeOrchestrator scrapeOrchestrator(ArchiveStore archiveStore,
                                                 FailureLedger failureLedger,
                                                 FetcherAdapter fetcherAdapter,
                                                 Clock clock,
                                                 ObjectProvider<RecordEnricher> enrichers) {
        return new ScrapeOrchestrator(archiveStore, failureLedger, fetcherAdapter, clock,
                properties.getWorkerCount(), Duration.ofMillis(properties.getPolitenessDelayMs()),
                enrichers.orderedStream().toList());
    }
}
