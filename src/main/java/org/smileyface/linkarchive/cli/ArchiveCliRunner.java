package org.smileyface.linkarchive.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkarchive.config.ArchiverProperties;
import org.smileyface.linkarchive.error.ConfigurationException;
import org.smileyface.linkarchive.error.StorageException;
import org.smileyface.linkarchive.ledger.FailureLedger;
import org.smileyface.linkarchive.link.LinkSource;
import org.smileyface.linkarchive.model.ArticleId;
import org.smileyface.linkarchive.model.LinkRecord;
import org.smileyface.linkarchive.processor.RunOptions;
import org.smileyface.linkarchive.processor.ScrapeOrchestrator;
import org.smileyface.linkarchive.report.RunSummary;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Command line entry point. Options:
 * <pre>
 *   --refresh-older-than=YYYY-MM-DD   re-fetch records scraped before that day (UTC), or an ISO instant
 *   --clear-permanent=&lt;articleId&gt;     forget a permanent failure before the run; may be repeated
 * </pre>
 * Exit code 0 when the run completes, whatever happened to individual links;
 * {@value #EXIT_STORAGE} when the archive or ledger is unusable;
 * {@value #EXIT_CONFIGURATION} for invalid options or configuration.
 */
@Component
public class ArchiveCliRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ArchiveCliRunner.class);

    public static final String OPT_REFRESH_OLDER_THAN = "refresh-older-than";
    public static final String OPT_CLEAR_PERMANENT = "clear-permanent";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_STORAGE = 2;
    public static final int EXIT_CONFIGURATION = 3;

    private final ArchiverProperties properties;
    private final LinkSource linkSource;
    private final FailureLedger failureLedger;
    private final ScrapeOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public ArchiveCliRunner(ArchiverProperties properties,
                            LinkSource linkSource,
                            FailureLedger failureLedger,
                            ScrapeOrchestrator orchestrator,
                            ConfigurableApplicationContext applicationContext) {
        this.properties = properties;
        this.linkSource = linkSource;
        this.failureLedger = failureLedger;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int code = execute(args);
        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }

    /**
     * Runs the archiver once with the given arguments.
     *
     * @return the process exit code
     */
    public int execute(ApplicationArguments args) {
        try {
            RunOptions options = parseOptions(args);
            clearPermanent(args.getOptionValues(OPT_CLEAR_PERMANENT));
            List<LinkRecord> links = linkSource.load();
            RunSummary summary = orchestrator.run(links, options);
            log.info("Archive run finished with state {}: {}", orchestrator.getState(), summary);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION;
        } catch (StorageException e) {
            log.error("Storage error, run aborted: {}", e.getMessage(), e);
            return EXIT_STORAGE;
        }
    }

    static RunOptions parseOptions(ApplicationArguments args) {
        List<String> values = args.getOptionValues(OPT_REFRESH_OLDER_THAN);
        if (values == null || values.isEmpty()) {
            return RunOptions.defaults();
        }
        if (values.size() > 1) {
            throw new ConfigurationException("--" + OPT_REFRESH_OLDER_THAN + " given more than once");
        }
        Instant cutoff = parseCutoff(values.get(0));
        log.info("Refresh mode: re-fetching records scraped before {}", cutoff);
        return RunOptions.refreshOlderThan(cutoff);
    }

    /**
     * "2024-03-01" is the start of that day in UTC; a full ISO-8601 instant is taken as is.
     */
    public static Instant parseCutoff(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("--" + OPT_REFRESH_OLDER_THAN + " needs a date (YYYY-MM-DD)");
        }
        String v = value.trim();
        try {
            return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException notADate) {
            try {
                return Instant.parse(v);
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("Invalid --" + OPT_REFRESH_OLDER_THAN + " value '" + v
                        + "', expected YYYY-MM-DD or an ISO-8601 instant", e);
            }
        }
    }

    private void clearPermanent(List<String> ids) {
        if (ids == null) {
            return;
        }
        for (String raw : ids) {
            String v = raw == null ? "" : raw.trim();
            if (!ArticleId.isValid(v)) {
                throw new ConfigurationException("Invalid --" + OPT_CLEAR_PERMANENT + " value '" + v + "', expected a 16 character article id");
            }
            if (!failureLedger.clearPermanent(ArticleId.of(v))) {
                log.warn("{} is not a permanent failure, nothing to clear", v);
            }
        }
    }

    /** Exit code for a startup failure, from the first known cause in the chain. */
    public static int exitCodeFor(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof ConfigurationException) return EXIT_CONFIGURATION;
            if (c instanceof StorageException) return EXIT_STORAGE;
            if (c.getCause() == c) break;
        }
        return EXIT_FAILURE;
    }

    public static String rootMessage(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null && c.getCause() != c) {
            if (c instanceof ConfigurationException || c instanceof StorageException) break;
            c = c.getCause();
        }
        return c.getMessage();
    }
}
