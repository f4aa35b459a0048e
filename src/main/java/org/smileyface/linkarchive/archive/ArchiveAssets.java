package org.smileyface.linkarchive.archive;

/**
 * Binary and raw content written next to the metadata document.
 *
 * @param rawHtml        fetched HTML, may be null
 * @param image          key image bytes, may be null
 * @param imageExtension file extension for the image without the dot, e.g. "png"
 * @param pdf            rendered PDF bytes, may be null
 */
public record ArchiveAssets(String rawHtml, byte[] image, String imageExtension, byte[] pdf) {

    public static final ArchiveAssets NONE = new ArchiveAssets(null, null, null, null);

    public ArchiveAssets {
        if (image != null && (imageExtension == null || imageExtension.isBlank())) {
            imageExtension = "jpg";
        }
    }

    public static ArchiveAssets html(String rawHtml) {
        return new ArchiveAssets(rawHtml, null, null, null);
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }

    public boolean hasPdf() {
        return pdf != null && pdf.length > 0;
    }
}
