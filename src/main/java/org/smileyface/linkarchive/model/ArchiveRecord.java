package org.smileyface.linkarchive.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.linkarchive.util.ArchiveUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Metadata document of one archived link, serialized as {@code data.json} inside the article
 * directory. The asset references are file names relative to that directory.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchiveRecord {

    // Identity
    private String articleId;          // 16 hex chars, see ArticleId
    private String url;                // Final URL after redirects
    private String originalUrl;        // URL as written in the link list

    // Scrape metadata
    private Instant scrapedAt;
    private Integer httpStatus;
    private String contentType;

    // Content
    private String title;
    private String bodyText;           // Main readable text, capped
    private String contentHash;        // SHA-256 over url + bodyText
    private String keyImageUrl;
    private StructuredData structuredData;
    private List<String> parseWarnings;

    // Assets
    private String rawHtmlRef;
    private String imageRef;
    private String pdfRef;

    // Link list context
    private List<String> tags;
    private String note;
    private String section;

    // Written by the dead-link recovery path; such records are never overwritten by a scrape
    private boolean resurrected;

    public ArchiveRecord() {
        // for JSON mapping
    }

    public String getArticleId() { return articleId; }
    public void setArticleId(String articleId) { this.articleId = articleId; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; this.contentHash = computeHash(url, bodyText); }

    public String getOriginalUrl() { return originalUrl; }
    public void setOriginalUrl(String originalUrl) { this.originalUrl = originalUrl; }

    public Instant getScrapedAt() { return scrapedAt; }
    public void setScrapedAt(Instant scrapedAt) { this.scrapedAt = scrapedAt; }

    public Integer getHttpStatus() { return httpStatus; }
    public void setHttpStatus(Integer httpStatus) { this.httpStatus = httpStatus; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getBodyText() { return bodyText; }
    public void setBodyText(String bodyText) { this.bodyText = bodyText; this.contentHash = computeHash(url, bodyText); }

    public String getContentHash() { return contentHash; }

    public String getKeyImageUrl() { return keyImageUrl; }
    public void setKeyImageUrl(String keyImageUrl) { this.keyImageUrl = keyImageUrl; }

    public StructuredData getStructuredData() { return structuredData; }
    public void setStructuredData(StructuredData structuredData) { this.structuredData = structuredData; }

    public List<String> getParseWarnings() { return parseWarnings; }
    public void setParseWarnings(List<String> parseWarnings) {
        this.parseWarnings = (parseWarnings == null || parseWarnings.isEmpty()) ? null : new ArrayList<>(parseWarnings);
    }

    public String getRawHtmlRef() { return rawHtmlRef; }
    public void setRawHtmlRef(String rawHtmlRef) { this.rawHtmlRef = rawHtmlRef; }

    public String getImageRef() { return imageRef; }
    public void setImageRef(String imageRef) { this.imageRef = imageRef; }

    public String getPdfRef() { return pdfRef; }
    public void setPdfRef(String pdfRef) { this.pdfRef = pdfRef; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags != null ? new ArrayList<>(tags) : null; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    public String getSection() { return section; }
    public void setSection(String section) { this.section = section; }

    public boolean isResurrected() { return resurrected; }
    public void setResurrected(boolean resurrected) { this.resurrected = resurrected; }

    /**
     * Hash over URL and body text, separated by a NUL character. Lets the site generator tell
     * whether a refresh actually changed anything.
     */
    public static String computeHash(String url, String bodyText) {
        String u = url == null ? "" : url;
        String c = bodyText == null ? "" : bodyText;
        return ArchiveUtils.sha256Hex(u + '\0' + c);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArchiveRecord that = (ArchiveRecord) o;
        return resurrected == that.resurrected
                && Objects.equals(articleId, that.articleId)
                && Objects.equals(url, that.url)
                && Objects.equals(scrapedAt, that.scrapedAt)
                && Objects.equals(contentHash, that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(articleId, url, scrapedAt, contentHash);
    }

    @Override
    public String toString() {
        return "ArchiveRecord{" +
                "articleId='" + articleId + '\'' +
                ", url='" + url + '\'' +
                ", scrapedAt=" + scrapedAt +
                ", httpStatus=" + httpStatus +
                ", title='" + title + '\'' +
                ", bodyLength=" + (bodyText != null ? bodyText.length() : 0) +
                ", imageRef='" + imageRef + '\'' +
                ", pdfRef='" + pdfRef + '\'' +
                ", resurrected=" + resurrected +
                '}';
    }
}
