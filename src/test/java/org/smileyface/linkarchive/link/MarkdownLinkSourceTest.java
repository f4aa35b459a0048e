package org.smileyface.linkarchive.link;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smileyface.linkarchive.error.ConfigurationException;
import org.smileyface.linkarchive.model.LinkRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MarkdownLinkSourceTest {

    @TempDir
    Path dir;

    @Test
    void load_parsesSectionsTitlesTagsAndNotes() throws IOException {
        Path file = dir.resolve("links.md");
        Files.writeString(file, """
                # My reading list

                - https://example.com/loose #misc
                ## 2024
                - [Sourdough basics](https://example.com/bread) #baking #recipe @note:try the rye variant
                * not a list item we read
                - https://example.com/plain-link#fragment-free #reading
                some prose mentioning https://example.com/ignored

                ## Tools
                -   [](https://example.com/untitled)
                - no link on this line #orphan
                """);

        List<LinkRecord> links = new MarkdownLinkSource(file).load();

        assertThat(links).extracting(LinkRecord::url).containsExactly(
                "https://example.com/loose",
                "https://example.com/bread",
                "https://example.com/plain-link",
                "https://example.com/untitled");

        LinkRecord loose = links.get(0);
        assertThat(loose.section()).isEqualTo(LinkRecord.DEFAULT_SECTION);
        assertThat(loose.tags()).containsExactly("misc");
        assertThat(loose.title()).isNull();

        LinkRecord bread = links.get(1);
        assertThat(bread.title()).isEqualTo("Sourdough basics");
        assertThat(bread.section()).isEqualTo("2024");
        assertThat(bread.tags()).containsExactly("baking", "recipe");
        assertThat(bread.note()).isEqualTo("try the rye variant");
        assertThat(bread.addedAt()).isNull();

        assertThat(links.get(2).tags()).as("URL stops before '#', the rest is a tag").containsExactly("fragment-free", "reading");

        LinkRecord untitled = links.get(3);
        assertThat(untitled.title()).isNull();
        assertThat(untitled.section()).isEqualTo("Tools");
        assertThat(untitled.tags()).isEmpty();
    }

    @Test
    void parse_keepsDuplicatesForTheOrchestrator() {
        List<LinkRecord> links = MarkdownLinkSource.parse(List.of(
                "- https://example.com/a",
                "- [Again](https://example.com/a) #dup"));
        assertThat(links).hasSize(2);
        assertThat(links.get(0).articleId()).isEqualTo(links.get(1).articleId());
    }

    @Test
    void parse_tagInsideUrlPathIsNotATag() {
        LinkRecord link = MarkdownLinkSource.parse(List.of("- [x](https://example.com/a/#/route) #real")).get(0);
        assertThat(link.url()).isEqualTo("https://example.com/a/#/route");
        assertThat(link.tags()).containsExactly("real");
    }

    @Test
    void load_missingFile_isConfigurationError() {
        MarkdownLinkSource source = new MarkdownLinkSource(dir.resolve("nope.md"));
        assertThatThrownBy(source::load)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nope.md");
    }
}
