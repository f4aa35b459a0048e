package org.smileyface.linkarchive.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Page metadata pulled from meta tags and JSON-LD blocks. Every field is optional; absent
 * values are null (or empty lists) and are left out of the serialized document.
 *
 * @param description   meta description
 * @param author        meta author or article:author
 * @param publishedAt   article:published_time or meta date, verbatim
 * @param siteName      og:site_name
 * @param language      lang attribute of the html element
 * @param jsonLdTypes   distinct {@code @type} values found in the JSON-LD blocks
 * @param jsonLd        parsed JSON-LD blocks, in document order
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StructuredData(String description,
                             String author,
                             String publishedAt,
                             String siteName,
                             String language,
                             List<String> jsonLdTypes,
                             List<JsonNode> jsonLd) {

    public StructuredData {
        description = blankToNull(description);
        author = blankToNull(author);
        publishedAt = blankToNull(publishedAt);
        siteName = blankToNull(siteName);
        language = blankToNull(language);
        jsonLdTypes = jsonLdTypes == null ? List.of() : List.copyOf(jsonLdTypes);
        jsonLd = jsonLd == null ? List.of() : List.copyOf(jsonLd);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return description == null && author == null && publishedAt == null && siteName == null
                && language == null && jsonLd.isEmpty();
    }

    public boolean hasType(String type) {
        return jsonLdTypes.stream().anyMatch(t -> t.equalsIgnoreCase(type));
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
