package org.smileyface.linkarchive.link;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.error.ConfigurationException;
import org.smileyface.linkarchive.model.LinkRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads links from a markdown file such as:
 * <pre>
 * ## 2024
 * - [Sourdough basics](https://example.com/bread) #baking #recipe @note:try the rye variant
 * - https://example.com/plain-link #reading
 * </pre>
 * A {@code ## } heading starts a section; list items before the first heading go to
 * {@value LinkRecord#DEFAULT_SECTION}. Other lines are ignored.
 */
public class MarkdownLinkSource implements LinkSource {

    private static final Logger log = LogManager.getLogger();

    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)\\]\\(([^)\\s]+)\\)");
    private static final Pattern PLAIN_URL = Pattern.compile("https?://[^\\s#@]+");
    private static final Pattern TAG = Pattern.compile("(?<![\\w/])#([\\w-]+)");
    private static final Pattern NOTE = Pattern.compile("@note:([^#]*)");

    private final Path file;

    public MarkdownLinkSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<LinkRecord> load() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read link list " + file.toAbsolutePath(), e);
        }
        List<LinkRecord> links = parse(lines);
        log.info("Parsed {} links from {}", links.size(), file);
        return links;
    }

    static List<LinkRecord> parse(List<String> lines) {
        List<LinkRecord> links = new ArrayList<>();
        String section = LinkRecord.DEFAULT_SECTION;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.startsWith("## ")) {
                String heading = trimmed.substring(3).trim();
                section = heading.isEmpty() ? LinkRecord.DEFAULT_SECTION : heading;
                continue;
            }
            if (!trimmed.startsWith("-")) {
                continue;
            }
            LinkRecord link = parseItem(trimmed.substring(1).trim(), section);
            if (link != null) {
                links.add(link);
            }
        }
        return links;
    }

    private static LinkRecord parseItem(String item, String section) {
        String url;
        String title = null;
        String rest;
        Matcher m = MARKDOWN_LINK.matcher(item);
        if (m.find()) {
            title = m.group(1).isBlank() ? null : m.group(1).trim();
            url = m.group(2);
            rest = item.substring(0, m.start()) + " " + item.substring(m.end());
        } else {
            Matcher plain = PLAIN_URL.matcher(item);
            if (!plain.find()) {
                return null;
            }
            url = plain.group();
            rest = item.substring(0, plain.start()) + " " + item.substring(plain.end());
        }

        Set<String> tags = new LinkedHashSet<>();
        Matcher t = TAG.matcher(rest);
        while (t.find()) {
            tags.add(t.group(1));
        }
        String note = null;
        Matcher n = NOTE.matcher(rest);
        if (n.find() && !n.group(1).isBlank()) {
            note = n.group(1).trim();
        }
        return new LinkRecord(url, title, tags, note, section, null);
    }
}
