package io.blobstorage.core;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * {@link BodyStream} backed by a blocking {@link InputStream}, typically the body
 * stream of an HTTP client library.
 *
 * <p>An optional companion resource (an HTTP response or connection handle) is closed
 * together with the input stream.
 */
public final class InputStreamBodyStream extends BodyStream {

    private final InputStream in;
    private final long length;
    private final Closeable resource;
    private boolean eof;

    public InputStreamBodyStream(InputStream in) {
        this(in, -1, null);
    }

    public InputStreamBodyStream(InputStream in, long length) {
        this(in, length, null);
    }

    /**
     * @param in the body source
     * @param length size hint, {@code -1} if unknown
     * @param resource released after {@code in} on close, may be {@code null}
     */
    public InputStreamBodyStream(InputStream in, long length, Closeable resource) {
        this.in = Objects.requireNonNull(in, "in");
        this.length = length < 0 ? -1 : length;
        this.resource = resource;
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    protected int onRead(Context context, byte[] buffer, int offset, int len) throws IOException {
        if (eof) return 0;
        int n;
        do {
            n = in.read(buffer, offset, len);
        } while (n == 0);
        if (n < 0) {
            eof = true;
            return 0;
        }
        return n;
    }

    @Override
    protected void onClose() throws IOException {
        try {
            in.close();
        } finally {
            if (resource != null) {
                resource.close();
            }
        }
    }
}
