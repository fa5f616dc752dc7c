package io.blobstorage.core;

import java.io.IOException;
import java.util.Objects;

/**
 * Exposes at most {@code limit} bytes of an upstream body. Used for bodies framed by
 * {@code Content-Length}, where the source may continue past the message.
 *
 * <p>An upstream that ends before the limit is reported as a short stream, not an
 * error; callers that need the full length compare it themselves.
 */
public final class LimitedBodyStream extends BodyStream {

    private final BodyStream upstream;
    private final long limit;
    private long consumed;

    public LimitedBodyStream(BodyStream upstream, long limit) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        this.limit = limit;
    }

    @Override
    public long length() {
        return limit;
    }

    @Override
    protected int onRead(Context context, byte[] buffer, int offset, int len) throws IOException {
        long remaining = limit - consumed;
        if (remaining <= 0) return 0;
        int n = upstream.read(context, buffer, offset, (int) Math.min(len, remaining));
        consumed += n;
        return n;
    }

    @Override
    protected void onClose() throws IOException {
        upstream.close();
    }
}
