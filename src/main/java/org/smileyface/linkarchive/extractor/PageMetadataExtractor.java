package org.smileyface.linkarchive.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkarchive.model.StructuredData;
import org.smileyface.linkarchive.util.ArchiveUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Pulls title, main text, key image and structured metadata out of a parsed page.
 * <p>
 * Main text is the text of the element found by the {@link ContentExtractor}, or the body text
 * when none matches; the meta description is used instead when it is longer. JSON-LD blocks
 * that do not parse are skipped with a warning.
 */
public class PageMetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(PageMetadataExtractor.class);

    private final ContentExtractor contentExtractor;
    private final ObjectMapper mapper;
    private final int maxTextChars;

    public PageMetadataExtractor(ContentExtractor contentExtractor, ObjectMapper mapper, int maxTextChars) {
        this.contentExtractor = Objects.requireNonNull(contentExtractor, "contentExtractor");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.maxTextChars = maxTextChars;
    }

    /**
     * @param doc parsed page; its base URI is used to make the image URL absolute
     */
    public PageExtraction extract(Document doc) {
        List<String> warnings = new ArrayList<>();

        String title = doc.title().isBlank() ? null : doc.title().trim();
        String description = firstMeta(doc, "meta[name=description]", "meta[property=og:description]");

        Optional<Element> main = contentExtractor.findMainContent(doc);
        String text;
        if (main.isPresent()) {
            text = main.get().text().trim();
        } else {
            text = doc.body() != null ? doc.body().text().trim() : "";
            log.debug("No main content element on {}, using full body", doc.location());
        }
        if (description != null && description.length() > text.length()) {
            text = description;
        }
        if (text.isEmpty()) {
            warnings.add("no readable body text");
        }

        List<JsonNode> jsonLd = new ArrayList<>();
        Set<String> types = new LinkedHashSet<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String json = script.data().trim();
            if (json.isEmpty()) continue;
            try {
                JsonNode node = mapper.readTree(json);
                jsonLd.add(node);
                collectTypes(node, types);
            } catch (JsonProcessingException e) {
                log.debug("Invalid JSON-LD block on {}: {}", doc.location(), e.getOriginalMessage());
                warnings.add("invalid JSON-LD block ignored");
            }
        }

        StructuredData data = new StructuredData(
                description,
                firstMeta(doc, "meta[name=author]", "meta[property=article:author]"),
                firstMeta(doc, "meta[property=article:published_time]", "meta[name=date]"),
                firstMeta(doc, "meta[property=og:site_name]"),
                doc.selectFirst("html[lang]") != null ? doc.selectFirst("html[lang]").attr("lang") : null,
                new ArrayList<>(types),
                jsonLd);

        return new PageExtraction(
                title,
                ArchiveUtils.truncate(text, maxTextChars),
                keyImageUrl(doc),
                data.isEmpty() ? null : data,
                warnings);
    }

    /** og:image, else the first img with a src, resolved against the page URL. */
    String keyImageUrl(Document doc) {
        Element og = doc.selectFirst("meta[property=og:image]");
        if (og != null && !og.attr("content").isBlank()) {
            String abs = og.absUrl("content");
            return abs.isEmpty() ? og.attr("content").trim() : abs;
        }
        Element img = doc.selectFirst("img[src]");
        if (img != null && !img.attr("src").isBlank()) {
            String abs = img.absUrl("src");
            return abs.isEmpty() ? img.attr("src").trim() : abs;
        }
        return null;
    }

    private static String firstMeta(Document doc, String... selectors) {
        for (String selector : selectors) {
            Element el = doc.selectFirst(selector);
            if (el != null && !el.attr("content").isBlank()) {
                return el.attr("content").trim();
            }
        }
        return null;
    }

    private static void collectTypes(JsonNode node, Set<String> types) {
        if (node.isArray()) {
            node.forEach(n -> collectTypes(n, types));
            return;
        }
        if (!node.isObject()) return;
        JsonNode type = node.get("@type");
        if (type != null) {
            if (type.isArray()) {
                type.forEach(t -> types.add(t.asText()));
            } else {
                types.add(type.asText());
            }
        }
        JsonNode graph = node.get("@graph");
        if (graph != null) {
            collectTypes(graph, types);
        }
    }
}
