package io.blobstorage.core;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Single-pass source of response body bytes.
 *
 * <p>Bytes come off the wire as they are read and are never buffered for re-reading:
 * once consumed, through {@link #read} or {@link #readToEnd}, they are gone from this
 * instance. A stream has a single owner and is not safe for concurrent reads.
 *
 * <p>{@link #read} returns {@code 0} at end of stream. Subclasses implement
 * {@link #onRead} and follow the same convention.
 */
public abstract class BodyStream implements Closeable {

    static final int CHUNK_SIZE = 8 * 1024;

    private boolean closed;

    /**
     * Size hint in bytes.
     *
     * @return the number of bytes the stream will produce, or {@code -1} if unknown
     */
    public abstract long length();

    /**
     * Reads up to {@code len} bytes into {@code buffer}.
     *
     * @return bytes read; {@code 0} once the stream is exhausted or when {@code len} is 0
     * @throws OperationCancelledException if {@code context} is cancelled before the read
     * @throws IOException if the underlying source fails or the stream is closed
     */
    public final int read(Context context, byte[] buffer, int offset, int len) throws IOException {
        Objects.requireNonNull(context, "context");
        Objects.checkFromIndexSize(offset, len, buffer.length);
        if (closed) throw new IOException("body stream is closed");
        context.throwIfCancelled();
        if (len == 0) return 0;
        return onRead(context, buffer, offset, len);
    }

    /**
     * Drains what is left of the stream.
     *
     * <p>Reads in fixed chunks until the source reports end of stream; the total size
     * does not need to be known up front. A drained stream yields an empty array.
     *
     * @throws OperationCancelledException if {@code context} is cancelled before the
     *         last chunk is read; no partial result is returned
     */
    public byte[] readToEnd(Context context) throws IOException {
        long hint = length();
        ByteArrayOutputStream out = new ByteArrayOutputStream(
                hint > 0 && hint < Integer.MAX_VALUE ? (int) Math.min(hint, 64 * 1024) : 256);
        byte[] chunk = new byte[CHUNK_SIZE];
        int n;
        while ((n = read(context, chunk, 0, chunk.length)) > 0) {
            out.write(chunk, 0, n);
        }
        return out.toByteArray();
    }

    /**
     * Static form of {@link #readToEnd(Context)}.
     */
    public static byte[] readToEnd(Context context, BodyStream stream) throws IOException {
        return Objects.requireNonNull(stream, "stream").readToEnd(context);
    }

    /**
     * Produces the next bytes. Only called with {@code len > 0} on an open stream.
     *
     * @return bytes read, {@code 0} at end of stream
     */
    protected abstract int onRead(Context context, byte[] buffer, int offset, int len) throws IOException;

    /** Releases the underlying source. */
    protected void onClose() throws IOException {
    }

    public final boolean isClosed() {
        return closed;
    }

    @Override
    public final void close() throws IOException {
        if (closed) return;
        closed = true;
        onClose();
    }
}
