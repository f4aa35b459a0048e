package org.smileyface.linkarchive.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.linkarchive.extractor.PageExtraction;
import org.smileyface.linkarchive.extractor.PageMetadataExtractor;
import org.smileyface.linkarchive.util.ArchiveUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ContentFetcher} that downloads pages with jsoup, follows redirects and extracts the
 * archived fields with a {@link PageMetadataExtractor}. The key image is downloaded with its own
 * timeout; a failed image download only adds a parse warning.
 */
public class JsoupContentFetcher implements ContentFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupContentFetcher.class);

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "svg");

    private final PageMetadataExtractor extractor;
    private final String userAgent;
    private final int requestTimeoutMs;
    private final int imageTimeoutMs;
    private final int maxImageBytes;
    private final int maxHtmlChars;

    public JsoupContentFetcher(PageMetadataExtractor extractor, String userAgent, int requestTimeoutMs,
                               int imageTimeoutMs, int maxImageBytes, int maxHtmlChars) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.userAgent = userAgent;
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
        this.imageTimeoutMs = Math.max(0, imageTimeoutMs);
        this.maxImageBytes = Math.max(0, maxImageBytes);
        this.maxHtmlChars = maxHtmlChars;
    }

    @Override
    public FetchResult fetch(String url) throws FetchException {
        Connection.Response res;
        Document doc;
        try {
            res = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(requestTimeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .execute();
            if (res.statusCode() >= 400) {
                throw new FetchException(FetchErrorKind.REMOTE_REJECTION,
                        "HTTP " + res.statusCode() + " " + Objects.toString(res.statusMessage(), ""), res.statusCode());
            }
            doc = res.parse();
        } catch (FetchException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            // malformed URL
            throw new FetchException(FetchErrorKind.REMOTE_REJECTION, "invalid URL: " + e.getMessage(), null, e);
        } catch (IOException e) {
            throw new FetchException(FetchErrorKind.fromException(e), e.toString(), null, e);
        }

        String finalUrl = res.url().toExternalForm();
        PageExtraction page = extractor.extract(doc);
        List<String> warnings = new ArrayList<>(page.warnings());

        byte[] image = null;
        String imageExtension = null;
        if (page.keyImageUrl() != null) {
            try {
                Connection.Response img = Jsoup.connect(page.keyImageUrl())
                        .userAgent(userAgent)
                        .timeout(imageTimeoutMs)
                        .maxBodySize(maxImageBytes)
                        .ignoreContentType(true)
                        .followRedirects(true)
                        .execute();
                image = img.bodyAsBytes();
                imageExtension = imageExtension(img.contentType(), page.keyImageUrl());
            } catch (IOException | IllegalArgumentException e) {
                log.info("Key image {} of {} not downloaded: {}", page.keyImageUrl(), finalUrl, e.getMessage());
                warnings.add("key image not downloaded: " + e.getMessage());
            }
        }

        return new FetchResult(
                finalUrl,
                res.statusCode(),
                res.contentType(),
                page.title(),
                page.bodyText(),
                ArchiveUtils.truncate(doc.outerHtml(), maxHtmlChars),
                page.keyImageUrl(),
                image,
                imageExtension,
                page.structuredData(),
                null,
                warnings);
    }

    /**
     * File extension for a downloaded image: from the content type if it names a known format,
     * else from the URL suffix, else "jpg".
     */
    static String imageExtension(String contentType, String imageUrl) {
        String ct = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("png")) return "png";
        if (ct.contains("gif")) return "gif";
        if (ct.contains("webp")) return "webp";
        if (ct.contains("svg")) return "svg";
        if (imageUrl != null) {
            String path = imageUrl;
            int cut = path.indexOf('?');
            if (cut >= 0) path = path.substring(0, cut);
            cut = path.indexOf('#');
            if (cut >= 0) path = path.substring(0, cut);
            int dot = path.lastIndexOf('.');
            if (dot >= 0 && dot > path.lastIndexOf('/')) {
                String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
                if (IMAGE_EXTENSIONS.contains(ext)) return ext;
            }
        }
        return "jpg";
    }
}
