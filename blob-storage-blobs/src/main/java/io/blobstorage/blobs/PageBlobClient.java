package io.blobstorage.blobs;

import io.blobstorage.core.BodyStream;
import io.blobstorage.core.Context;
import io.blobstorage.core.HeaderStore;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.Response;
import io.blobstorage.http.HttpTransportException;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

/**
 * Page blobs: random-access blobs made of 512-byte pages.
 *
 * <p>Every size, offset and length passed here must be a multiple of
 * {@link BlobProtocol#PAGE_SIZE}; anything else is rejected before a request is sent.
 */
public class PageBlobClient extends BlobClient {

    public PageBlobClient(String blobUri) {
        super(blobUri);
    }

    public PageBlobClient(String blobUri, BlobClientOptions options) {
        super(blobUri, options);
    }

    PageBlobClient(URI url, BlobPipeline pipeline) {
        super(url, pipeline);
    }

    @Override
    public PageBlobClient withSnapshot(String snapshot) {
        return new PageBlobClient(snapshotUrl(snapshot), pipeline);
    }

    /** Creates a zero-filled page blob of {@code size} bytes. */
    public BlobContentInfo create(long size) throws HttpTransportException {
        requireAligned("size", size);
        HeaderStore h = pipeline.sendForHeaders(Context.none(), HttpRequest.put(url)
                .header(BlobProtocol.H_BLOB_TYPE, BlobType.PAGE_BLOB.value())
                .header(BlobProtocol.H_BLOB_CONTENT_LENGTH, Long.toString(size))
                .build());
        return new BlobContentInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                null,
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_SEQUENCE_NUMBER),
                BlobResponses.booleanValue(h, BlobProtocol.H_REQUEST_SERVER_ENCRYPTED));
    }

    /**
     * Writes {@code content} at {@code offset}. The stream is read to its end and its
     * length must be a whole number of pages; the caller keeps ownership.
     */
    public PageInfo uploadPages(BodyStream content, long offset, Context context) throws HttpTransportException, IOException {
        Objects.requireNonNull(content, "content");
        requireAligned("offset", offset);
        long hint = content.length();
        if (hint >= 0) {
            requirePages("content length", hint);
        }
        byte[] body = content.readToEnd(context);
        requirePages("content length", body.length);
        HeaderStore h = pipeline.sendForHeaders(context, HttpRequest.put(pageUrl())
                .header(BlobProtocol.H_PAGE_WRITE, BlobProtocol.PAGE_WRITE_UPDATE)
                .header(BlobProtocol.H_RANGE, new BlobRange(offset, (long) body.length).toHeaderValue())
                .header(BlobProtocol.H_CONTENT_TYPE, BlobProtocol.CT_OCTET_STREAM)
                .body(body)
                .build());
        return pageInfo(h);
    }

    /**
     * Writes pages read by the service from {@code sourceUri}.
     *
     * @param sourceUri public source, or one carrying a SAS token
     */
    public PageInfo uploadPagesFromUri(String sourceUri, long sourceOffset, long sourceLength, long destinationOffset)
            throws HttpTransportException {
        Objects.requireNonNull(sourceUri, "sourceUri");
        requireAligned("sourceOffset", sourceOffset);
        requirePages("sourceLength", sourceLength);
        requireAligned("destinationOffset", destinationOffset);
        HeaderStore h = pipeline.sendForHeaders(Context.none(), HttpRequest.put(pageUrl())
                .header(BlobProtocol.H_PAGE_WRITE, BlobProtocol.PAGE_WRITE_UPDATE)
                .header(BlobProtocol.H_COPY_SOURCE, sourceUri)
                .header(BlobProtocol.H_SOURCE_RANGE, new BlobRange(sourceOffset, sourceLength).toHeaderValue())
                .header(BlobProtocol.H_RANGE, new BlobRange(destinationOffset, sourceLength).toHeaderValue())
                .build());
        return pageInfo(h);
    }

    /** Releases the pages in the range; they read back as zeros. */
    public PageInfo clearPages(long offset, long length) throws HttpTransportException {
        requireAligned("offset", offset);
        requirePages("length", length);
        HeaderStore h = pipeline.sendForHeaders(Context.none(), HttpRequest.put(pageUrl())
                .header(BlobProtocol.H_PAGE_WRITE, BlobProtocol.PAGE_WRITE_CLEAR)
                .header(BlobProtocol.H_RANGE, new BlobRange(offset, length).toHeaderValue())
                .build());
        return pageInfo(h);
    }

    /** Grows or shrinks the blob; pages beyond a new, smaller size are discarded. */
    public PageBlobInfo resize(long size) throws HttpTransportException {
        requireAligned("size", size);
        HeaderStore h = pipeline.sendForHeaders(Context.none(),
                HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_PROPERTIES))
                        .header(BlobProtocol.H_BLOB_CONTENT_LENGTH, Long.toString(size))
                        .build());
        return new PageBlobInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_SEQUENCE_NUMBER));
    }

    /** Lists the valid and cleared page ranges of the blob, or of this snapshot. */
    public PageRangesInfo getPageRanges() throws HttpTransportException {
        Context context = Context.none();
        Response response = pipeline.send(context,
                HttpRequest.get(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_PAGE_LIST)).build());
        try {
            HeaderStore h = response.headers();
            PageList list = PageList.parse(response.readBody(context));
            return new PageRangesInfo(
                    BlobResponses.string(h, BlobProtocol.H_REQUEST_ID),
                    BlobResponses.string(h, BlobProtocol.H_VERSION),
                    BlobResponses.string(h, BlobProtocol.H_ETAG),
                    BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                    BlobResponses.longValue(h, BlobProtocol.H_BLOB_CONTENT_LENGTH, 0L),
                    list.pageRanges(),
                    list.clearRanges());
        } catch (IOException e) {
            throw new HttpTransportException("Failed to read page list", e);
        } finally {
            BlobPipeline.closeQuietly(response);
        }
    }

    /**
     * Starts an incremental copy from a snapshot of another page blob.
     *
     * @param sourceUri URI of the source snapshot, including its {@code snapshot} parameter
     */
    public BlobCopyInfo startCopyIncremental(String sourceUri) throws HttpTransportException {
        Objects.requireNonNull(sourceUri, "sourceUri");
        HeaderStore h = pipeline.sendForHeaders(Context.none(),
                HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_INCREMENTAL_COPY))
                        .header(BlobProtocol.H_COPY_SOURCE, sourceUri)
                        .build());
        return copyInfo(h);
    }

    private URI pageUrl() {
        return BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_PAGE);
    }

    private static PageInfo pageInfo(HeaderStore h) {
        return new PageInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.string(h, BlobProtocol.H_CONTENT_MD5),
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_SEQUENCE_NUMBER));
    }

    private static void requireAligned(String what, long value) {
        if (value < 0 || value % BlobProtocol.PAGE_SIZE != 0) {
            throw new IllegalArgumentException(what + " must be a non-negative multiple of " + BlobProtocol.PAGE_SIZE + ": " + value);
        }
    }

    private static void requirePages(String what, long value) {
        if (value <= 0 || value % BlobProtocol.PAGE_SIZE != 0) {
            throw new IllegalArgumentException(what + " must be a positive multiple of " + BlobProtocol.PAGE_SIZE + ": " + value);
        }
    }
}
