package org.smileyface.linkarchive.config;

import org.smileyface.linkarchive.error.ConfigurationException;
import org.smileyface.linkarchive.extractor.ClassFragmentContentRule;
import org.smileyface.linkarchive.extractor.ContentExtractor;
import org.smileyface.linkarchive.extractor.ContentRule;
import org.smileyface.linkarchive.extractor.MinCharacterRule;
import org.smileyface.linkarchive.extractor.TagNameContentRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration properties of the link archiver.
 */
@ConfigurationProperties(prefix = "archiver")
public class ArchiverProperties {

    public static final Set<String> LEDGER_TYPES = Set.of("file", "in-memory", "redis");

    /** Root directory of the archive; one sub-directory per article. */
    private String archiveDir = "archive";

    /** Markdown file with the curated link list. */
    private String linksFile = "links.md";

    private Ledger ledger = new Ledger();

    /** Number of links processed in parallel. */
    private int workerCount = 2;

    /** Hard deadline for one page fetch including parsing and the key image, in milliseconds. */
    private int fetchTimeoutMs = 15000;

    /** HTTP read timeout of the page request, in milliseconds. */
    private int requestTimeoutMs = 4000;

    /** HTTP timeout of the key image download, in milliseconds. */
    private int imageTimeoutMs = 4000;

    /** Key images larger than this are truncated by jsoup; 0 means unlimited. */
    private int maxImageBytes = 5 * 1024 * 1024;

    private String userAgent = "Mozilla/5.0 (compatible; LinkArchiver/0.1)";

    /** Pause of a worker after each fetch, in milliseconds. */
    private int politenessDelayMs = 1000;

    private int maxTextChars = 5000;

    private int maxHtmlChars = 50000;

    /** Minimum text length of an element to be taken as the main content. */
    private int minBodyChars = 1;

    private MainContent mainContent = new MainContent();

    private Cli cli = new Cli();

    /**
     * Checks the values Spring bound.
     *
     * @throws ConfigurationException describing the first invalid value
     */
    public void validate() {
        if (archiveDir == null || archiveDir.isBlank()) {
            throw new ConfigurationException("archiver.archive-dir must not be blank");
        }
        if (workerCount < 1) {
            throw new ConfigurationException("archiver.worker-count must be >= 1, was " + workerCount);
        }
        if (fetchTimeoutMs <= 0) {
            throw new ConfigurationException("archiver.fetch-timeout-ms must be > 0, was " + fetchTimeoutMs);
        }
        if (politenessDelayMs < 0) {
            throw new ConfigurationException("archiver.politeness-delay-ms must be >= 0, was " + politenessDelayMs);
        }
        if (!LEDGER_TYPES.contains(ledger.getType())) {
            throw new ConfigurationException("archiver.ledger.type must be one of " + LEDGER_TYPES + ", was " + ledger.getType());
        }
        if ("file".equals(ledger.getType()) && (ledger.getDir() == null || ledger.getDir().isBlank())) {
            throw new ConfigurationException("archiver.ledger.dir must not be blank for the file ledger");
        }
    }

    /**
     * Main content rules in priority order: configured tags first, then class fragments.
     */
    public ContentExtractor buildContentExtractor() {
        List<ContentRule> candidates = new ArrayList<>();
        for (String tag : mainContent.getTags()) {
            if (tag != null && !tag.isBlank()) candidates.add(new TagNameContentRule(tag.trim()));
        }
        for (String fragment : mainContent.getClassFragments()) {
            if (fragment != null && !fragment.isBlank()) candidates.add(new ClassFragmentContentRule(fragment.trim()));
        }
        List<ContentRule> required = minBodyChars > 0 ? List.of(new MinCharacterRule(minBodyChars)) : List.of();
        return new ContentExtractor(candidates, required);
    }

    public String getArchiveDir() { return archiveDir; }
    public void setArchiveDir(String archiveDir) { this.archiveDir = archiveDir; }

    public String getLinksFile() { return linksFile; }
    public void setLinksFile(String linksFile) { this.linksFile = linksFile; }

    public Ledger getLedger() { return ledger; }
    public void setLedger(Ledger ledger) { this.ledger = ledger != null ? ledger : new Ledger(); }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public int getFetchTimeoutMs() { return fetchTimeoutMs; }
    public void setFetchTimeoutMs(int fetchTimeoutMs) { this.fetchTimeoutMs = fetchTimeoutMs; }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getImageTimeoutMs() { return imageTimeoutMs; }
    public void setImageTimeoutMs(int imageTimeoutMs) { this.imageTimeoutMs = imageTimeoutMs; }

    public int getMaxImageBytes() { return maxImageBytes; }
    public void setMaxImageBytes(int maxImageBytes) { this.maxImageBytes = maxImageBytes; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public int getPolitenessDelayMs() { return politenessDelayMs; }
    public void setPolitenessDelayMs(int politenessDelayMs) { this.politenessDelayMs = politenessDelayMs; }

    public int getMaxTextChars() { return maxTextChars; }
    public void setMaxTextChars(int maxTextChars) { this.maxTextChars = maxTextChars; }

    public int getMaxHtmlChars() { return maxHtmlChars; }
    public void setMaxHtmlChars(int maxHtmlChars) { this.maxHtmlChars = maxHtmlChars; }

    public int getMinBodyChars() { return minBodyChars; }
    public void setMinBodyChars(int minBodyChars) { this.minBodyChars = minBodyChars; }

    public MainContent getMainContent() { return mainContent; }
    public void setMainContent(MainContent mainContent) { this.mainContent = mainContent != null ? mainContent : new MainContent(); }

    public Cli getCli() { return cli; }
    public void setCli(Cli cli) { this.cli = cli != null ? cli : new Cli(); }

    public static class Ledger {
        /** One of "file", "in-memory", "redis". */
        private String type = "file";

        /** Directory of the file ledger documents. */
        private String dir = "archive-state";

        /** Key prefix of the Redis ledger. */
        private String namespace = "archiver";

        public String getType() { return type; }
        public void setType(String type) {
            this.type = (type == null || type.isBlank()) ? "file" : type.trim().toLowerCase(Locale.ROOT);
        }

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) {
            this.namespace = (namespace == null || namespace.isBlank()) ? "archiver" : namespace;
        }
    }

    public static class MainContent {
        private List<String> tags = new ArrayList<>(List.of("article", "main"));
        private List<String> classFragments = new ArrayList<>(List.of("content", "post", "recipe"));

        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags != null ? tags : new ArrayList<>(); }

        public List<String> getClassFragments() { return classFragments; }
        public void setClassFragments(List<String> classFragments) {
            this.classFragments = classFragments != null ? classFragments : new ArrayList<>();
        }
    }

    public static class Cli {
        /** Run the archiver when the application starts. */
        private boolean run = true;

        /** Exit the JVM with the run's exit code afterwards. */
        private boolean exitAfterRun = true;

        public boolean isRun() { return run; }
        public void setRun(boolean run) { this.run = run; }

        public boolean isExitAfterRun() { return exitAfterRun; }
        public void setExitAfterRun(boolean exitAfterRun) { this.exitAfterRun = exitAfterRun; }
    }
}
