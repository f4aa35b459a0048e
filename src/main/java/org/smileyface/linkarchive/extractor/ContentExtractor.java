package org.smileyface.linkarchive.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates the main content element of a page with an ordered list of candidate
 * {@link ContentRule}s plus a set of rules every candidate must also satisfy.
 */
public final class ContentExtractor {

    private final List<ContentRule> candidates;
    private final List<ContentRule> required;

    /**
     * @param candidates rules in priority order; the first rule with a matching element wins
     * @param required   rules a matching element must satisfy as well (may be empty)
     */
    public ContentExtractor(List<ContentRule> candidates, Collection<ContentRule> required) {
        this.candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
        this.required = required == null ? List.of() : List.copyOf(required);
    }

    /**
     * Tries each candidate rule in order. For a rule, traversal is depth-first in document order
     * and the first element that matches it (and all required rules) is returned.
     *
     * @return the main content element, or empty when no rule matches
     */
    public Optional<Element> findMainContent(Document doc) {
        if (doc == null) return Optional.empty();
        Element root = doc.body() != null ? doc.body() : doc;
        for (ContentRule rule : candidates) {
            Element found = findFirst(root, rule);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }

    private Element findFirst(Element el, ContentRule rule) {
        if (rule.isMatched(el) && matchesAll(el)) {
            return el;
        }
        for (Element child : el.children()) {
            Element found = findFirst(child, rule);
            if (found != null) return found;
        }
        return null;
    }

    private boolean matchesAll(Element el) {
        for (ContentRule r : required) {
            if (r == null || !r.isMatched(el)) return false;
        }
        return true;
    }
}
