package org.smileyface.linkarchive.extractor;

import org.jsoup.nodes.Element;

import java.util.Locale;

/**
 * Matches {@code div} elements whose {@code class} attribute contains a fragment, e.g.
 * "content" matches {@code class="entry-content"} and {@code class="contentArea"}.
 * <p>
 * Unlike {@link Element#hasClass(String)} this is a substring test over the raw attribute
 * value, case-insensitive, because blog themes rarely use a bare "content" class.
 */
public final class ClassFragmentContentRule implements ContentRule {

    private final String fragment;

    /**
     * @param fragment the text to look for in the class attribute; must not be null or blank
     */
    public ClassFragmentContentRule(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            throw new IllegalArgumentException("fragment must not be null/blank");
        }
        this.fragment = fragment.trim().toLowerCase(Locale.ROOT);
    }

    public String getFragment() {
        return fragment;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null || !element.tagName().equalsIgnoreCase("div")) return false;
        String cls = element.attr("class");
        return !cls.isEmpty() && cls.toLowerCase(Locale.ROOT).contains(fragment);
    }

    @Override
    public String toString() {
        return "class*=" + fragment;
    }
}
