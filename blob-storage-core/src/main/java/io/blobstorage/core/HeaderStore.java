package io.blobstorage.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-value header collection for one HTTP message.
 *
 * <p>Names are stored with their original case; {@code content-length} and
 * {@code Content-Length} are kept as two separate names. Lookups through
 * {@link #firstValue(String)}, {@link #values(String)} and {@link #contains(String)}
 * ignore case. Repeated names keep every value in the order it was added.
 *
 * <p>Not thread-safe. A store is filled by one parser and then only read.
 */
public final class HeaderStore {

    private final Map<String, List<String>> entries;
    private final boolean readOnly;

    public HeaderStore() {
        this(new LinkedHashMap<>(), false);
    }

    private HeaderStore(Map<String, List<String>> entries, boolean readOnly) {
        this.entries = entries;
        this.readOnly = readOnly;
    }

    /**
     * Parses one raw header line and adds it.
     *
     * <p>The name is everything before the first {@code ':'}. Spaces and horizontal
     * tabs after the colon are skipped; the value then runs up to the first
     * {@code '\r'} or the end of the line. A line without a colon is not a header
     * (blank separator line, status noise, garbage) and is dropped without error.
     *
     * @param line a single header line, possibly {@code \r}-terminated
     */
    public void addLine(String line) {
        checkWritable();
        if (line == null) return;

        int colon = line.indexOf(':');
        if (colon < 0) return;

        String name = line.substring(0, colon);
        int start = colon + 1;
        while (start < line.length() && (line.charAt(start) == ' ' || line.charAt(start) == '\t')) {
            start++;
        }
        int end = line.indexOf('\r', start);
        if (end < 0) end = line.length();

        append(name, line.substring(start, end));
    }

    /**
     * Adds a structured header. Existing values for the same name are kept.
     */
    public void add(String name, String value) {
        checkWritable();
        if (name == null || value == null) {
            throw new NullPointerException(name == null ? "name" : "value");
        }
        append(name, value);
    }

    public Optional<String> firstValue(String name) {
        if (name == null) return Optional.empty();
        for (Map.Entry<String, List<String>> e : entries.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.of(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every value stored under {@code name} in any letter case,
     * grouped by stored name in insertion order.
     */
    public List<String> values(String name) {
        if (name == null) return List.of();
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : entries.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                out.addAll(e.getValue());
            }
        }
        return Collections.unmodifiableList(out);
    }

    public boolean contains(String name) {
        return firstValue(name).isPresent();
    }

    /** Stored names, case preserved. */
    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /** Unmodifiable snapshot keyed by stored name. */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    /** Number of values, duplicates included. */
    public int size() {
        int n = 0;
        for (List<String> v : entries.values()) n += v.size();
        return n;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Returns a view over the same storage that rejects mutation. Later additions
     * to this store are visible through the view.
     */
    public HeaderStore readOnlyView() {
        return readOnly ? this : new HeaderStore(entries, true);
    }

    private void append(String name, String value) {
        entries.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
    }

    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("headers are read-only");
        }
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
