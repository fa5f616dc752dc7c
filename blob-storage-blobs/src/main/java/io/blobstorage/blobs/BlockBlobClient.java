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
 * Block blobs: blobs written in a single upload.
 */
public class BlockBlobClient extends BlobClient {

    public BlockBlobClient(String blobUri) {
        super(blobUri);
    }

    public BlockBlobClient(String blobUri, BlobClientOptions options) {
        super(blobUri, options);
    }

    BlockBlobClient(URI url, BlobPipeline pipeline) {
        super(url, pipeline);
    }

    @Override
    public BlockBlobClient withSnapshot(String snapshot) {
        return new BlockBlobClient(snapshotUrl(snapshot), pipeline);
    }

    /**
     * Creates the blob, or replaces it, with {@code content}. The stream is read to its
     * end; the caller keeps ownership and closes it.
     */
    public BlobContentInfo upload(BodyStream content, Context context) throws HttpTransportException, IOException {
        return upload(content, BlobHttpHeaders.empty(), context);
    }

    /** As {@link #upload(BodyStream, Context)}, also storing {@code httpHeaders}. */
    public BlobContentInfo upload(BodyStream content, BlobHttpHeaders httpHeaders, Context context)
            throws HttpTransportException, IOException {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(httpHeaders, "httpHeaders");
        byte[] body = content.readToEnd(context);
        HttpRequest.Builder request = HttpRequest.put(url)
                .header(BlobProtocol.H_BLOB_TYPE, BlobType.BLOCK_BLOB.value())
                .header(BlobProtocol.H_CONTENT_TYPE, BlobProtocol.CT_OCTET_STREAM)
                .body(body);
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_TYPE, httpHeaders.contentType());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_ENCODING, httpHeaders.contentEncoding());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_LANGUAGE, httpHeaders.contentLanguage());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_DISPOSITION, httpHeaders.contentDisposition());
        putIfPresent(request, BlobProtocol.H_BLOB_CACHE_CONTROL, httpHeaders.cacheControl());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_MD5, httpHeaders.contentMd5());
        HeaderStore h = pipeline.sendForHeaders(context, request.build());
        return new BlobContentInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.string(h, BlobProtocol.H_CONTENT_MD5),
                null,
                BlobResponses.booleanValue(h, BlobProtocol.H_REQUEST_SERVER_ENCRYPTED));
    }
}
