package org.smileyface.linkarchive.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContentExtractorTest {

    private static final List<ContentRule> DEFAULT_CANDIDATES = List.of(
            new TagNameContentRule("article"),
            new TagNameContentRule("main"),
            new ClassFragmentContentRule("content"));

    @Test
    void findMainContent_nullDocument_isEmpty() {
        ContentExtractor extractor = new ContentExtractor(DEFAULT_CANDIDATES, List.of());
        assertTrue(extractor.findMainContent(null).isEmpty());
    }

    @Test
    void findMainContent_noCandidates_isEmpty() {
        Document doc = Jsoup.parse("<html><body><article>text</article></body></html>");
        assertTrue(new ContentExtractor(List.of(), null).findMainContent(doc).isEmpty());
    }

    @Test
    void findMainContent_earlierRuleWinsOverDocumentOrder() {
        String html = """
                <html><body>
                  <div class='site-content'>Wrapper text <main>Main text</main></div>
                  <article>Article text</article>
                </body></html>
                """;
        ContentExtractor extractor = new ContentExtractor(DEFAULT_CANDIDATES, List.of());

        Optional<Element> main = extractor.findMainContent(Jsoup.parse(html));

        assertTrue(main.isPresent());
        assertEquals("article", main.get().tagName());
        assertEquals("Article text", main.get().text());
    }

    @Test
    void findMainContent_firstMatchInDocumentOrderForOneRule() {
        String html = """
                <html><body>
                  <div class='post-content'>First <div class='inner-content'>nested</div></div>
                  <div class='content'>Second</div>
                </body></html>
                """;
        ContentExtractor extractor = new ContentExtractor(List.of(new ClassFragmentContentRule("content")), List.of());

        Element el = extractor.findMainContent(Jsoup.parse(html)).orElseThrow();

        assertEquals("post-content", el.className());
        assertEquals("First nested", el.text());
    }

    @Test
    void findMainContent_requiredRulesSkipEmptyWrappers() {
        String html = """
                <html><body>
                  <div class='content-header'></div>
                  <div class='entry-content'><p>The actual post.</p></div>
                </body></html>
                """;
        ContentExtractor extractor = new ContentExtractor(
                List.of(new ClassFragmentContentRule("content")),
                List.of(new MinCharacterRule(5)));

        Element el = extractor.findMainContent(Jsoup.parse(html)).orElseThrow();

        assertEquals("entry-content", el.className());
    }

    @Test
    void findMainContent_nothingMatches_isEmpty() {
        Document doc = Jsoup.parse("<html><body><div>plain</div><p>page</p></body></html>");
        ContentExtractor extractor = new ContentExtractor(DEFAULT_CANDIDATES, List.of(new MinCharacterRule(1)));
        assertTrue(extractor.findMainContent(doc).isEmpty());
    }
}
