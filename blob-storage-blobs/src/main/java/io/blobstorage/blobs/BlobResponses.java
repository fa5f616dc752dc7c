package io.blobstorage.blobs;

import io.blobstorage.core.HeaderStore;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads typed values out of blob service response headers. Absent or unparsable values
 * come back as {@code null}; the service contract, not this class, decides which headers
 * a response carries.
 */
final class BlobResponses {
    private BlobResponses() {}

    static String string(HeaderStore headers, String name) {
        return headers.firstValue(name).orElse(null);
    }

    static Long longValue(HeaderStore headers, String name) {
        String v = string(headers, name);
        if (v == null || v.isBlank()) return null;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static long longValue(HeaderStore headers, String name, long fallback) {
        Long v = longValue(headers, name);
        return v == null ? fallback : v;
    }

    static Boolean booleanValue(HeaderStore headers, String name) {
        String v = string(headers, name);
        if (v == null || v.isBlank()) return null;
        return Boolean.parseBoolean(v.trim());
    }

    static OffsetDateTime date(HeaderStore headers, String name) {
        String v = string(headers, name);
        if (v == null || v.isBlank()) return null;
        try {
            return OffsetDateTime.parse(v.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** {@code x-ms-meta-*} headers, keyed by the name after the prefix. */
    static Map<String, String> metadata(HeaderStore headers) {
        Map<String, String> out = new LinkedHashMap<>();
        int prefix = BlobProtocol.H_META_PREFIX.length();
        for (String name : headers.names()) {
            if (name.length() > prefix && name.toLowerCase(Locale.ROOT).startsWith(BlobProtocol.H_META_PREFIX)) {
                headers.firstValue(name).ifPresent(v -> out.put(name.substring(prefix), v));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    static BlobHttpHeaders httpHeaders(HeaderStore headers) {
        return new BlobHttpHeaders(
                string(headers, BlobProtocol.H_CONTENT_TYPE),
                string(headers, BlobProtocol.H_CONTENT_ENCODING),
                string(headers, BlobProtocol.H_CONTENT_LANGUAGE),
                string(headers, BlobProtocol.H_CONTENT_DISPOSITION),
                string(headers, BlobProtocol.H_CACHE_CONTROL),
                string(headers, BlobProtocol.H_CONTENT_MD5));
    }

    /**
     * Total blob size from {@code Content-Range: bytes a-b/total}, or {@code null} when the
     * header is absent or the total is {@code *}.
     */
    static Long totalFromContentRange(HeaderStore headers) {
        String v = string(headers, BlobProtocol.H_CONTENT_RANGE);
        if (v == null) return null;
        int slash = v.lastIndexOf('/');
        if (slash < 0) return null;
        try {
            return Long.parseLong(v.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
