package io.blobstorage.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link BodyStream} over an in-memory byte range. The array is not copied.
 */
public final class MemoryBodyStream extends BodyStream {

    private final byte[] data;
    private final int end;
    private int position;

    public MemoryBodyStream(byte[] data) {
        this(data, 0, Objects.requireNonNull(data, "data").length);
    }

    public MemoryBodyStream(byte[] data, int offset, int length) {
        this.data = Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, length, data.length);
        this.position = offset;
        this.end = offset + length;
    }

    public static MemoryBodyStream of(String text) {
        return new MemoryBodyStream(text.getBytes(StandardCharsets.UTF_8));
    }

    public static MemoryBodyStream empty() {
        return new MemoryBodyStream(new byte[0]);
    }

    @Override
    public long length() {
        return end - position;
    }

    @Override
    protected int onRead(Context context, byte[] buffer, int offset, int len) {
        int n = Math.min(len, end - position);
        if (n <= 0) return 0;
        System.arraycopy(data, position, buffer, offset, n);
        position += n;
        return n;
    }
}
