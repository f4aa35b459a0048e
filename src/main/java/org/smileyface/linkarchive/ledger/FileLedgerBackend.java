package org.smileyface.linkarchive.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.error.StorageException;
import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.PermanentFailureEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Ledger backend writing two JSON documents into a directory:
 * {@code failures.json} (article id to failure record) and {@code permanent-failures.json}
 * (article id to permanent entry). Both are kept in memory and rewritten in full through a
 * temporary file and an atomic rename on every mutation.
 */
public class FileLedgerBackend implements LedgerBackend {

    private static final Logger log = LogManager.getLogger();

    public static final String FAILURES_FILE = "failures.json";
    public static final String PERMANENT_FILE = "permanent-failures.json";

    private static final TypeReference<TreeMap<String, FailureRecord>> FAILURES_TYPE = new TypeReference<>() {};
    private static final TypeReference<TreeMap<String, PermanentFailureEntry>> PERMANENT_TYPE = new TypeReference<>() {};

    private final Path failuresFile;
    private final Path permanentFile;
    private final ObjectMapper mapper;

    private final TreeMap<String, FailureRecord> failures;
    private final TreeMap<String, PermanentFailureEntry> permanent;

    public FileLedgerBackend(Path dir, ObjectMapper mapper) {
        Objects.requireNonNull(dir, "dir");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create ledger directory " + dir, e);
        }
        this.failuresFile = dir.resolve(FAILURES_FILE);
        this.permanentFile = dir.resolve(PERMANENT_FILE);
        this.failures = readDocument(failuresFile, FAILURES_TYPE);
        this.permanent = readDocument(permanentFile, PERMANENT_TYPE);
        log.info("Loaded failure ledger from {} ({} failure record(s), {} permanent)", dir, failures.size(), permanent.size());
    }

    @Override
    public synchronized Map<String, FailureRecord> loadFailures() {
        return new TreeMap<>(failures);
    }

    @Override
    public synchronized Map<String, PermanentFailureEntry> loadPermanent() {
        return new TreeMap<>(permanent);
    }

    @Override
    public synchronized void saveFailure(FailureRecord record) {
        failures.put(record.articleId(), record);
        writeDocument(failuresFile, failures);
    }

    @Override
    public synchronized void appendPermanent(String articleId, PermanentFailureEntry entry) {
        if (permanent.putIfAbsent(articleId, entry) == null) {
            writeDocument(permanentFile, permanent);
        }
    }

    @Override
    public synchronized void removePermanent(String articleId) {
        if (permanent.remove(articleId) != null) {
            writeDocument(permanentFile, permanent);
        }
    }

    @Override
    public String name() {
        return "file";
    }

    private <T> TreeMap<String, T> readDocument(Path file, TypeReference<TreeMap<String, T>> type) {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, T> map = mapper.readValue(file.toFile(), type);
            return map != null ? map : new TreeMap<>();
        } catch (IOException e) {
            throw new StorageException("Cannot read ledger document " + file, e);
        }
    }

    private void writeDocument(Path file, Map<String, ?> content) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), content);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Cannot write ledger document " + file, e);
        }
    }
}
