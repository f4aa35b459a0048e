package org.smileyface.linkarchive.fetch;

import org.smileyface.linkarchive.model.StructuredData;

import java.util.List;

/**
 * Normalized content of a successfully fetched page.
 *
 * @param finalUrl       URL after redirects
 * @param httpStatus     HTTP status of the final response
 * @param contentType    content type of the final response
 * @param title          page title, may be null
 * @param bodyText       main readable text
 * @param rawHtml        HTML as archived (possibly capped)
 * @param keyImageUrl    absolute URL of the key image, may be null
 * @param image          downloaded key image, null when absent or not downloaded
 * @param imageExtension file extension of {@code image}
 * @param structuredData metadata from meta tags and JSON-LD, may be null
 * @param pdf            PDF rendering, null unless the fetcher renders one
 * @param parseWarnings  non-fatal problems met while parsing; never null
 */
public record FetchResult(String finalUrl,
                          int httpStatus,
                          String contentType,
                          String title,
                          String bodyText,
                          String rawHtml,
                          String keyImageUrl,
                          byte[] image,
                          String imageExtension,
                          StructuredData structuredData,
                          byte[] pdf,
                          List<String> parseWarnings) {

    public FetchResult {
        parseWarnings = parseWarnings == null ? List.of() : List.copyOf(parseWarnings);
    }

    /** Minimal successful result, mostly for stub fetchers. */
    public static FetchResult of(String finalUrl, String title, String bodyText, String rawHtml) {
        return new FetchResult(finalUrl, 200, "text/html", title, bodyText, rawHtml,
                null, null, null, null, null, List.of());
    }

    public boolean isPartial() {
        return !parseWarnings.isEmpty();
    }
}
