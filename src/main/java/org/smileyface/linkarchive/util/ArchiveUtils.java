package org.smileyface.linkarchive.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Set;

public class ArchiveUtils {

    /** Query parameters that only carry campaign tracking and never change the page. */
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_content", "utm_term");

    private ArchiveUtils() {
        // No instanciation
    }

    /**
     * Canonical form of a link URL used for identity: lower-case scheme and host, "/" for an
     * empty path, tracking parameters removed. Other query parameters keep their original order
     * and encoding, and the fragment is kept, so in-page anchors are distinct links. Input that cannot be parsed as an absolute URI is returned
     * trimmed but otherwise untouched.
     */
    public static String canonicalizeUrl(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            return trimmed;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://");
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null) sb.append(userInfo).append('@');
        String host = uri.getHost();
        if (host == null) {
            return trimmed;
        }
        sb.append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) sb.append(':').append(uri.getPort());

        String path = uri.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);

        String query = stripTrackingParams(uri.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);
        String fragment = uri.getRawFragment();
        if (fragment != null) sb.append('#').append(fragment);
        return sb.toString();
    }

    private static String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        StringBuilder kept = new StringBuilder();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            if (TRACKING_PARAMS.contains(name)) continue;
            if (kept.length() > 0) kept.append('&');
            kept.append(pair);
        }
        return kept.toString();
    }

    /**
     * Hex encoded SHA-256 of the UTF-8 bytes of {@code value}. Null is hashed as the empty string.
     */
    public static String sha256Hex(String value) {
        byte[] data = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    /**
     * Cuts {@code value} to at most {@code maxChars} characters; null stays null.
     */
    public static String truncate(String value, int maxChars) {
        if (value == null || maxChars <= 0 || value.length() <= maxChars) return value;
        return value.substring(0, maxChars);
    }
}
