package org.smileyface.linkarchive.extractor;

import org.smileyface.linkarchive.model.StructuredData;

import java.util.List;

/**
 * What {@link PageMetadataExtractor} pulls out of one parsed page.
 *
 * @param title          document title, null if absent
 * @param bodyText       main readable text, capped
 * @param keyImageUrl    absolute URL of the key image, null if none
 * @param structuredData meta tag and JSON-LD metadata, null if the page has none
 * @param warnings       non-fatal parse problems
 */
public record PageExtraction(String title,
                             String bodyText,
                             String keyImageUrl,
                             StructuredData structuredData,
                             List<String> warnings) {

    public PageExtraction {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
