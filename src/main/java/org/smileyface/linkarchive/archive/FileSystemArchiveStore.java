package org.smileyface.linkarchive.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.error.StorageException;
import org.smileyface.linkarchive.model.ArchiveRecord;
import org.smileyface.linkarchive.model.ArticleId;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Archive laid out as one directory per article under a root directory:
 * <pre>
 *   archive/&lt;articleId&gt;/data.json      metadata document
 *   archive/&lt;articleId&gt;/content.html   raw HTML
 *   archive/&lt;articleId&gt;/image.&lt;ext&gt;    key image (optional)
 *   archive/&lt;articleId&gt;/archive.pdf    PDF rendering (optional)
 * </pre>
 * A write fills {@code <articleId>.tmp} first and then swaps it in with directory renames:
 * the current directory is moved to {@code <articleId>.old}, the staging directory is moved
 * to the final name, and the old one is deleted. {@link #recover()} runs on construction and
 * removes staging leftovers and rolls back a swap that was cut off between the two renames.
 */
public class FileSystemArchiveStore implements ArchiveStore {

    private static final Logger log = LogManager.getLogger();

    public static final String DATA_FILE = "data.json";
    public static final String CONTENT_FILE = "content.html";
    public static final String PDF_FILE = "archive.pdf";
    public static final String IMAGE_BASENAME = "image";

    static final String STAGING_SUFFIX = ".tmp";
    static final String RETIRED_SUFFIX = ".old";

    private final Path root;
    private final ObjectMapper mapper;
    private final ReentrantLock commitLock = new ReentrantLock();

    public FileSystemArchiveStore(Path root, ObjectMapper mapper) {
        this.root = Objects.requireNonNull(root, "root");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create archive directory " + root, e);
        }
        recover();
    }

    @Override
    public boolean exists(ArticleId articleId) {
        return read(articleId).isPresent();
    }

    @Override
    public Optional<ArchiveRecord> read(ArticleId articleId) {
        Path dataFile = root.resolve(articleId.value()).resolve(DATA_FILE);
        if (!Files.isRegularFile(dataFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(dataFile.toFile(), ArchiveRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata for {} treated as not archived: {}", articleId, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read " + dataFile, e);
        }
    }

    @Override
    public void write(ArticleId articleId, ArchiveRecord record, ArchiveAssets assets) {
        Objects.requireNonNull(articleId, "articleId");
        Objects.requireNonNull(record, "record");
        ArchiveAssets a = assets == null ? ArchiveAssets.NONE : assets;
        Path staging = root.resolve(articleId.value() + STAGING_SUFFIX);
        try {
            deleteRecursively(staging);
            Files.createDirectories(staging);

            record.setArticleId(articleId.value());
            record.setRawHtmlRef(null);
            record.setImageRef(null);
            record.setPdfRef(null);

            if (a.rawHtml() != null) {
                Files.writeString(staging.resolve(CONTENT_FILE), a.rawHtml(), StandardCharsets.UTF_8);
                record.setRawHtmlRef(CONTENT_FILE);
            }
            if (a.hasImage()) {
                String imageFile = IMAGE_BASENAME + "." + a.imageExtension();
                Files.write(staging.resolve(imageFile), a.image());
                record.setImageRef(imageFile);
            }
            if (a.hasPdf()) {
                Files.write(staging.resolve(PDF_FILE), a.pdf());
                record.setPdfRef(PDF_FILE);
            }
            // metadata last: a staging directory without data.json is never mistaken for a record
            mapper.writerWithDefaultPrettyPrinter().writeValue(staging.resolve(DATA_FILE).toFile(), record);

            beforeCommit(articleId, staging);
            commit(articleId, staging);
            log.info("Committed archive entry {} ({})", articleId, record.getUrl());
        } catch (IOException e) {
            discardStaging(staging);
            throw new StorageException("Cannot write archive entry " + articleId + " under " + root, e);
        }
    }

    /**
     * Called after the staging directory is complete and before it is swapped in.
     * Overridden in tests to simulate a crash at that point.
     */
    protected void beforeCommit(ArticleId articleId, Path staging) throws IOException {
        // no-op
    }

    private void commit(ArticleId articleId, Path staging) throws IOException {
        Path target = root.resolve(articleId.value());
        Path retired = root.resolve(articleId.value() + RETIRED_SUFFIX);
        commitLock.lock();
        try {
            deleteRecursively(retired);
            boolean hadPrevious = Files.exists(target);
            if (hadPrevious) {
                Files.move(target, retired, StandardCopyOption.ATOMIC_MOVE);
            }
            try {
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                if (hadPrevious) {
                    Files.move(retired, target, StandardCopyOption.ATOMIC_MOVE);
                }
                throw e;
            }
            deleteRecursively(retired);
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public List<ArticleId> list() {
        List<ArticleId> ids = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                String name = dir.getFileName().toString();
                if (ArticleId.isValid(name) && Files.isRegularFile(dir.resolve(DATA_FILE))) {
                    ids.add(ArticleId.of(name));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list archive directory " + root, e);
        }
        Collections.sort(ids);
        return ids;
    }

    /**
     * Cleans up after an interrupted write. Staging directories are deleted; a retired directory
     * whose replacement never arrived is moved back, otherwise it is deleted.
     */
    public void recover() {
        commitLock.lock();
        int discarded = 0;
        int restored = 0;
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            List<Path> entries = new ArrayList<>();
            dirs.forEach(entries::add);
            for (Path dir : entries) {
                String name = dir.getFileName().toString();
                if (name.endsWith(STAGING_SUFFIX)) {
                    deleteRecursively(dir);
                    discarded++;
                } else if (name.endsWith(RETIRED_SUFFIX)) {
                    Path target = root.resolve(name.substring(0, name.length() - RETIRED_SUFFIX.length()));
                    if (Files.exists(target)) {
                        deleteRecursively(dir);
                    } else {
                        Files.move(dir, target, StandardCopyOption.ATOMIC_MOVE);
                        restored++;
                    }
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot recover archive directory " + root, e);
        } finally {
            commitLock.unlock();
        }
        if (discarded > 0 || restored > 0) {
            log.warn("Archive recovery under {}: discarded {} staging dir(s), restored {} entr(ies)", root, discarded, restored);
        }
    }

    private void discardStaging(Path staging) {
        try {
            deleteRecursively(staging);
        } catch (IOException cleanup) {
            log.warn("Failed to clean up staging directory {}; it will be removed on next start", staging, cleanup);
        }
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) return;
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> all = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : all) {
                try {
                    Files.delete(p);
                } catch (NoSuchFileException ignored) {
                    // already gone
                }
            }
        }
    }
}
