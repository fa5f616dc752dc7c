package io.blobstorage.blobs;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Query-string helpers for blob URIs.
 *
 * <p>Existing parameters (a SAS token, a snapshot id) keep their position and their raw
 * encoding; only the parameters being set or removed are touched.
 */
public final class BlobUrl {
    private BlobUrl() {}

    /**
     * Returns {@code base} with {@code name} set to {@code value}, replacing any existing
     * occurrence. A {@code null} or empty value removes the parameter.
     */
    public static URI withParameter(URI base, String name, String value) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(name, "name");
        List<String> parts = new ArrayList<>();
        for (String part : rawParts(base)) {
            if (!name.equals(decode(keyOf(part)))) {
                parts.add(part);
            }
        }
        if (value != null && !value.isEmpty()) {
            parts.add(encode(name) + "=" + encode(value));
        }
        return rebuild(base, parts);
    }

    /** Appends every entry of {@code params} through {@link #withParameter}. */
    public static URI withParameters(URI base, Map<String, String> params) {
        URI out = base;
        for (Map.Entry<String, String> e : params.entrySet()) {
            out = withParameter(out, e.getKey(), e.getValue());
        }
        return out;
    }

    /** Decoded value of the first {@code name} parameter, or {@code null}. */
    public static String parameter(URI uri, String name) {
        for (String part : rawParts(uri)) {
            if (name.equals(decode(keyOf(part)))) {
                int eq = part.indexOf('=');
                return eq < 0 ? "" : decode(part.substring(eq + 1));
            }
        }
        return null;
    }

    private static List<String> rawParts(URI uri) {
        String q = uri.getRawQuery();
        List<String> out = new ArrayList<>();
        if (q == null || q.isEmpty()) return out;
        for (String part : q.split("&")) {
            if (!part.isEmpty()) out.add(part);
        }
        return out;
    }

    private static String keyOf(String part) {
        int eq = part.indexOf('=');
        return eq < 0 ? part : part.substring(0, eq);
    }

    private static URI rebuild(URI base, List<String> parts) {
        String s = base.toString();
        int cut = s.indexOf('?');
        if (cut < 0) cut = s.indexOf('#');
        String prefix = cut < 0 ? s : s.substring(0, cut);
        String fragment = base.getRawFragment();
        StringBuilder sb = new StringBuilder(prefix);
        if (!parts.isEmpty()) {
            sb.append('?').append(String.join("&", parts));
        }
        if (fragment != null) {
            sb.append('#').append(fragment);
        }
        return URI.create(sb.toString());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
