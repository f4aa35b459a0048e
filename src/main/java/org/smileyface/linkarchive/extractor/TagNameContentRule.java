package org.smileyface.linkarchive.extractor;

import org.jsoup.nodes.Element;

/**
 * Matches elements by tag name, case-insensitive. Used for {@code <article>} and {@code <main>}.
 */
public final class TagNameContentRule implements ContentRule {

    private final String tagName;

    public TagNameContentRule(String tagName) {
        if (tagName == null || tagName.isBlank()) {
            throw new IllegalArgumentException("tagName must not be null/blank");
        }
        this.tagName = tagName.trim();
    }

    public String getTagName() {
        return tagName;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        return element.tagName().equalsIgnoreCase(tagName);
    }

    @Override
    public String toString() {
        return "tag:" + tagName;
    }
}
