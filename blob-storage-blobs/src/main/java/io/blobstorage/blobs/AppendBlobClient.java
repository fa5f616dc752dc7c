package io.blobstorage.blobs;

import io.blobstorage.core.BodyStream;
import io.blobstorage.core.Context;
import io.blobstorage.core.HeaderStore;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.http.HttpTransportException;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

/**
 * Append blobs: blobs that only grow, one block at a time.
 */
public class AppendBlobClient extends BlobClient {

    public AppendBlobClient(String blobUri) {
        super(blobUri);
    }

    public AppendBlobClient(String blobUri, BlobClientOptions options) {
        super(blobUri, options);
    }

    AppendBlobClient(URI url, BlobPipeline pipeline) {
        super(url, pipeline);
    }

    @Override
    public AppendBlobClient withSnapshot(String snapshot) {
        return new AppendBlobClient(snapshotUrl(snapshot), pipeline);
    }

    /** Creates an empty append blob, replacing any blob at this URI. */
    public BlobContentInfo create() throws HttpTransportException {
        HeaderStore h = pipeline.sendForHeaders(Context.none(), HttpRequest.put(url)
                .header(BlobProtocol.H_BLOB_TYPE, BlobType.APPEND_BLOB.value())
                .build());
        return new BlobContentInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                null,
                null,
                BlobResponses.booleanValue(h, BlobProtocol.H_REQUEST_SERVER_ENCRYPTED));
    }

    /**
     * Commits {@code content} as a new block at the end of the blob. The stream is read to
     * its end; the caller keeps ownership.
     */
    public BlobAppendInfo appendBlock(BodyStream content, Context context) throws HttpTransportException, IOException {
        Objects.requireNonNull(content, "content");
        byte[] body = content.readToEnd(context);
        HeaderStore h = pipeline.sendForHeaders(context,
                HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_APPEND_BLOCK))
                        .header(BlobProtocol.H_CONTENT_TYPE, BlobProtocol.CT_OCTET_STREAM)
                        .body(body)
                        .build());
        return new BlobAppendInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_APPEND_OFFSET, 0L),
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_COMMITTED_BLOCK_COUNT, 0L));
    }
}
