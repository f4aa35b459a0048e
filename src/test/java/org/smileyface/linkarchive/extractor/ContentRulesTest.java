package org.smileyface.linkarchive.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentRulesTest {

    private static Element first(String html, String selector) {
        return Jsoup.parse(html).selectFirst(selector);
    }

    @Test
    void tagName_matchesCaseInsensitive() {
        Element article = first("<article>x</article>", "article");
        assertTrue(new TagNameContentRule("ARTICLE").isMatched(article));
        assertFalse(new TagNameContentRule("main").isMatched(article));
        assertFalse(new TagNameContentRule("article").isMatched(null));
    }

    @Test
    void tagName_blankIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TagNameContentRule(" "));
        assertThrows(IllegalArgumentException.class, () -> new TagNameContentRule(null));
    }

    @Test
    void classFragment_matchesSubstringOnDivsOnly() {
        ClassFragmentContentRule rule = new ClassFragmentContentRule("Content");
        assertEquals("content", rule.getFragment());
        assertTrue(rule.isMatched(first("<div class='entry-content'>x</div>", "div")));
        assertTrue(rule.isMatched(first("<div class='mainContentArea'>x</div>", "div")));
        assertFalse(rule.isMatched(first("<section class='content'>x</section>", "section")));
        assertFalse(rule.isMatched(first("<div class='sidebar'>x</div>", "div")));
        assertFalse(rule.isMatched(first("<div>x</div>", "div")));
    }

    @Test
    void classFragment_blankIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ClassFragmentContentRule(""));
    }

    @Test
    void minCharacter_countsTrimmedText() {
        Element el = first("<div>   abc   </div>", "div");
        assertTrue(new MinCharacterRule(3).isMatched(el));
        assertFalse(new MinCharacterRule(4).isMatched(el));
        assertFalse(new MinCharacterRule(0).isMatched(null));
    }

    @Test
    void minCharacter_negativeIsZero() {
        MinCharacterRule rule = new MinCharacterRule(-5);
        assertEquals(0, rule.getMinChars());
        assertTrue(rule.isMatched(first("<div></div>", "div")));
    }
}
