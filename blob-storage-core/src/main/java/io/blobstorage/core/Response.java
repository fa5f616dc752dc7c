package io.blobstorage.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * One HTTP response: status line, headers and an owned body.
 *
 * <p>The status code and reason phrase are fixed at construction. A transport adds
 * headers while parsing, then attaches the body once; callers only ever see headers
 * through the read-only view returned by {@link #headers()}.
 *
 * <p>The response owns its {@link BodyStream} until {@link #takeBodyStream()} hands it
 * to the caller. Closing the response closes a body it still owns.
 */
public final class Response implements Closeable {

    private final int statusCode;
    private final String reasonPhrase;
    private final HeaderStore headers = new HeaderStore();
    private final HeaderStore headersView = headers.readOnlyView();
    private BodyStream body;
    private boolean bodyTaken;

    public Response(int statusCode, String reasonPhrase) {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("invalid status code: " + statusCode);
        }
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase == null ? "" : reasonPhrase;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reasonPhrase() {
        return reasonPhrase;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** Parses and adds one raw header line. See {@link HeaderStore#addLine(String)}. */
    public void addHeaderLine(String line) {
        headers.addLine(line);
    }

    public void addHeader(String name, String value) {
        headers.add(name, value);
    }

    /** Read-only view of every header, duplicates included. */
    public HeaderStore headers() {
        return headersView;
    }

    /**
     * Attaches the body, closing any body attached before.
     *
     * @throws IOException if the previous body fails to close
     */
    public void setBodyStream(BodyStream stream) throws IOException {
        BodyStream previous = this.body;
        this.body = stream;
        this.bodyTaken = false;
        if (previous != null && previous != stream) {
            previous.close();
        }
    }

    /** The owned body, or {@code null} when there is none or it was taken. */
    public BodyStream bodyStream() {
        return body;
    }

    /**
     * Transfers ownership of the body to the caller, who then has to close it.
     *
     * @return the body, or {@code null} if the response never had one
     * @throws IllegalStateException if the body was already taken
     */
    public BodyStream takeBodyStream() {
        if (bodyTaken) {
            throw new IllegalStateException("body stream already taken");
        }
        BodyStream out = body;
        body = null;
        bodyTaken = true;
        return out;
    }

    /**
     * Takes the body, drains it and closes it.
     *
     * @return the body bytes, empty when there is no body
     */
    public byte[] readBody(Context context) throws IOException {
        BodyStream stream = takeBodyStream();
        if (stream == null) return new byte[0];
        try (stream) {
            return stream.readToEnd(context);
        }
    }

    @Override
    public void close() throws IOException {
        BodyStream owned = body;
        body = null;
        if (owned != null) {
            owned.close();
        }
    }

    @Override
    public String toString() {
        return "Response{" + statusCode + " " + reasonPhrase + ", headers=" + headers + "}";
    }
}
