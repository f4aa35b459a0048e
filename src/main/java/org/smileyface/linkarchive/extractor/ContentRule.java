package org.smileyface.linkarchive.extractor;

import org.jsoup.nodes.Element;

/**
 * A rule used by {@link ContentExtractor} to decide whether a given HTML element
 * can hold the main content of a page.
 */
@FunctionalInterface
public interface ContentRule {
    /**
     * Returns true if the provided element matches this rule.
     *
     * @param element a non-null Jsoup Element from the parsed HTML document
     * @return true if matched
     */
    boolean isMatched(Element element);
}
