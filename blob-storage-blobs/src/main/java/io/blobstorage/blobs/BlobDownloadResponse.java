package io.blobstorage.blobs;

import io.blobstorage.core.BodyStream;
import io.blobstorage.core.Context;
import io.blobstorage.core.Response;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Result of {@link BlobClient#download()}: the blob's properties plus its content as a
 * streamed body. Close it, or close the body taken from it.
 */
public final class BlobDownloadResponse implements Closeable {

    private final BlobDownloadInfo info;
    private final Response response;

    BlobDownloadResponse(BlobDownloadInfo info, Response response) {
        this.info = Objects.requireNonNull(info, "info");
        this.response = Objects.requireNonNull(response, "response");
    }

    public BlobDownloadInfo info() {
        return info;
    }

    public int statusCode() {
        return response.statusCode();
    }

    /** The underlying response, for headers this type does not surface. */
    public Response rawResponse() {
        return response;
    }

    /**
     * Hands the content stream to the caller. See {@link Response#takeBodyStream()}.
     */
    public BodyStream takeBodyStream() {
        return response.takeBodyStream();
    }

    /** Reads the whole content and releases the connection. */
    public byte[] readBody(Context context) throws IOException {
        return response.readBody(context);
    }

    @Override
    public void close() throws IOException {
        response.close();
    }
}
