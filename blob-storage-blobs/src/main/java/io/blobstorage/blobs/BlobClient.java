package io.blobstorage.blobs;

import io.blobstorage.core.Context;
import io.blobstorage.core.HeaderStore;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.Response;
import io.blobstorage.http.HttpTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;

/**
 * Operations shared by every blob type.
 *
 * <p>A client is bound to one blob URI, optionally carrying a SAS token or a snapshot id,
 * and is safe to share between threads. Requests are not signed: the URI must grant
 * access on its own.
 */
public class BlobClient {

    private static final Logger LOG = LoggerFactory.getLogger(BlobClient.class);

    final URI url;
    final BlobPipeline pipeline;

    /**
     * @param blobUri URI of the blob: account, container and blob name, possibly with a
     *        SAS token
     */
    public BlobClient(String blobUri) {
        this(blobUri, BlobClientOptions.defaults());
    }

    public BlobClient(String blobUri, BlobClientOptions options) {
        this(URI.create(Objects.requireNonNull(blobUri, "blobUri")), new BlobPipeline(options));
    }

    BlobClient(URI url, BlobPipeline pipeline) {
        this.url = Objects.requireNonNull(url, "url");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /** A block blob client for the same URI, sharing this client's pipeline. */
    public BlockBlobClient getBlockBlobClient() {
        return new BlockBlobClient(url, pipeline);
    }

    /** An append blob client for the same URI, sharing this client's pipeline. */
    public AppendBlobClient getAppendBlobClient() {
        return new AppendBlobClient(url, pipeline);
    }

    /** A page blob client for the same URI, sharing this client's pipeline. */
    public PageBlobClient getPageBlobClient() {
        return new PageBlobClient(url, pipeline);
    }

    public String getUri() {
        return url.toString();
    }

    /**
     * A client for the given snapshot of this blob.
     *
     * @param snapshot snapshot id; {@code null} or empty addresses the base blob
     */
    public BlobClient withSnapshot(String snapshot) {
        return new BlobClient(snapshotUrl(snapshot), pipeline);
    }

    URI snapshotUrl(String snapshot) {
        return BlobUrl.withParameter(url, BlobProtocol.Q_SNAPSHOT, snapshot);
    }

    /**
     * Returns user metadata, standard HTTP properties and system properties of the blob.
     * The content is not downloaded.
     */
    public BlobProperties getProperties() throws HttpTransportException {
        HeaderStore h = pipeline.sendForHeaders(Context.none(), HttpRequest.head(url).build());
        return new BlobProperties(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.date(h, BlobProtocol.H_CREATION_TIME),
                BlobResponses.longValue(h, BlobProtocol.H_CONTENT_LENGTH, 0L),
                BlobType.fromValue(BlobResponses.string(h, BlobProtocol.H_BLOB_TYPE)),
                BlobResponses.httpHeaders(h),
                BlobResponses.metadata(h),
                BlobResponses.booleanValue(h, BlobProtocol.H_SERVER_ENCRYPTED),
                BlobResponses.string(h, BlobProtocol.H_ENCRYPTION_KEY_SHA256),
                AccessTier.fromValue(BlobResponses.string(h, BlobProtocol.H_ACCESS_TIER)),
                BlobResponses.string(h, BlobProtocol.H_COPY_ID),
                BlobResponses.string(h, BlobProtocol.H_COPY_STATUS),
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_SEQUENCE_NUMBER),
                BlobResponses.longValue(h, BlobProtocol.H_BLOB_COMMITTED_BLOCK_COUNT));
    }

    /**
     * Replaces the blob's standard HTTP properties. Components left {@code null} are cleared.
     *
     * @return the new ETag
     */
    public String setHttpHeaders(BlobHttpHeaders httpHeaders) throws HttpTransportException {
        Objects.requireNonNull(httpHeaders, "httpHeaders");
        HttpRequest.Builder request = HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_PROPERTIES));
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_TYPE, httpHeaders.contentType());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_ENCODING, httpHeaders.contentEncoding());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_LANGUAGE, httpHeaders.contentLanguage());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_DISPOSITION, httpHeaders.contentDisposition());
        putIfPresent(request, BlobProtocol.H_BLOB_CACHE_CONTROL, httpHeaders.cacheControl());
        putIfPresent(request, BlobProtocol.H_BLOB_CONTENT_MD5, httpHeaders.contentMd5());
        HeaderStore h = pipeline.sendForHeaders(Context.none(), request.build());
        return BlobResponses.string(h, BlobProtocol.H_ETAG);
    }

    /**
     * Replaces all user metadata of the blob. An empty map removes it.
     *
     * @return the new ETag
     */
    public String setMetadata(Map<String, String> metadata) throws HttpTransportException {
        Objects.requireNonNull(metadata, "metadata");
        HttpRequest.Builder request = HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_METADATA));
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            request.header(BlobProtocol.H_META_PREFIX + e.getKey(), e.getValue());
        }
        HeaderStore h = pipeline.sendForHeaders(Context.none(), request.build());
        return BlobResponses.string(h, BlobProtocol.H_ETAG);
    }

    public void setAccessTier(AccessTier tier) throws HttpTransportException {
        Objects.requireNonNull(tier, "tier");
        pipeline.sendForHeaders(Context.none(), HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_TIER))
                .header(BlobProtocol.H_ACCESS_TIER, tier.value())
                .build());
    }

    /**
     * Starts a server-side copy from {@code sourceUri} into this blob.
     *
     * @param sourceUri source blob URI, public or carrying a SAS token when it lives in
     *        another account
     */
    public BlobCopyInfo startCopyFromUri(String sourceUri) throws HttpTransportException {
        Objects.requireNonNull(sourceUri, "sourceUri");
        HeaderStore h = pipeline.sendForHeaders(Context.none(), HttpRequest.put(url)
                .header(BlobProtocol.H_COPY_SOURCE, sourceUri)
                .build());
        return copyInfo(h);
    }

    /**
     * Aborts a pending copy, leaving this blob with zero length and full metadata.
     */
    public void abortCopyFromUri(String copyId) throws HttpTransportException {
        Objects.requireNonNull(copyId, "copyId");
        URI target = BlobUrl.withParameter(
                BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_COPY),
                BlobProtocol.Q_COPY_ID, copyId);
        pipeline.sendForHeaders(Context.none(), HttpRequest.put(target)
                .header(BlobProtocol.H_COPY_ACTION, BlobProtocol.COPY_ACTION_ABORT)
                .build());
    }

    /** Downloads the whole blob. */
    public BlobDownloadResponse download() throws HttpTransportException {
        return download(null, Context.none());
    }

    /**
     * Downloads the blob or a range of it. The content is streamed: the returned response
     * owns the connection until it, or the body taken from it, is closed.
     *
     * @param range the range to fetch, {@code null} for the whole blob
     */
    public BlobDownloadResponse download(BlobRange range, Context context) throws HttpTransportException {
        return download(range, null, context);
    }

    BlobDownloadResponse download(BlobRange range, String ifMatch, Context context) throws HttpTransportException {
        HttpRequest.Builder request = HttpRequest.get(url);
        if (range != null) {
            request.header(BlobProtocol.H_RANGE, range.toHeaderValue());
        }
        if (ifMatch != null) {
            request.header("If-Match", ifMatch);
        }
        Response response = pipeline.send(context, request.build());
        return new BlobDownloadResponse(downloadInfo(response.headers()), response);
    }

    /**
     * Downloads the blob into {@code buffer} using parallel ranged requests.
     *
     * @throws IllegalArgumentException if the blob does not fit in {@code buffer}
     */
    public BlobDownloadInfo downloadToBuffer(byte[] buffer, Context context) throws HttpTransportException, IOException {
        Objects.requireNonNull(buffer, "buffer");
        return newDownloader().download(context,
                size -> {
                    if (size > buffer.length) {
                        throw new IllegalArgumentException("Buffer of " + buffer.length + " bytes is too small for a blob of " + size + " bytes");
                    }
                },
                (offset, data, length) -> System.arraycopy(data, 0, buffer, (int) offset, length));
    }

    /**
     * Downloads the blob into {@code file} using parallel ranged requests. The file is
     * created or truncated; it is deleted again if the download fails.
     */
    public BlobDownloadInfo downloadToFile(Path file, Context context) throws HttpTransportException, IOException {
        Objects.requireNonNull(file, "file");
        boolean done = false;
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            BlobDownloadInfo info = newDownloader().download(context, size -> {}, (offset, data, length) -> {
                ByteBuffer src = ByteBuffer.wrap(data, 0, length);
                long position = offset;
                while (src.hasRemaining()) {
                    position += channel.write(src, position);
                }
            });
            done = true;
            return info;
        } finally {
            if (!done) {
                deletePartialFile(file);
            }
        }
    }

    private ParallelDownloader newDownloader() {
        BlobClientOptions options = pipeline.options();
        return new ParallelDownloader(this, options.downloadChunkSize(), options.downloadConcurrency());
    }

    private static void deletePartialFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete partially downloaded file {}", file, e);
        }
    }

    /** Creates a read-only snapshot of the blob. */
    public BlobSnapshotInfo createSnapshot() throws HttpTransportException {
        HeaderStore h = pipeline.sendForHeaders(Context.none(),
                HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_SNAPSHOT)).build());
        return new BlobSnapshotInfo(
                BlobResponses.string(h, BlobProtocol.H_SNAPSHOT),
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED));
    }

    public void delete() throws HttpTransportException {
        delete(DeleteSnapshotsOption.NONE);
    }

    /**
     * Marks the blob, or this snapshot, for deletion. A blob with snapshots can only be
     * deleted together with them ({@link DeleteSnapshotsOption#INCLUDE}).
     */
    public void delete(DeleteSnapshotsOption snapshots) throws HttpTransportException {
        HttpRequest.Builder request = HttpRequest.delete(url);
        if (snapshots != null && snapshots.value() != null) {
            request.header(BlobProtocol.H_DELETE_SNAPSHOTS, snapshots.value());
        }
        pipeline.sendForHeaders(Context.none(), request.build());
    }

    /** Restores a soft-deleted blob and its soft-deleted snapshots. */
    public void undelete() throws HttpTransportException {
        pipeline.sendForHeaders(Context.none(),
                HttpRequest.put(BlobUrl.withParameter(url, BlobProtocol.Q_COMP, BlobProtocol.COMP_UNDELETE)).build());
    }

    static BlobCopyInfo copyInfo(HeaderStore h) {
        return new BlobCopyInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.string(h, BlobProtocol.H_COPY_ID),
                BlobResponses.string(h, BlobProtocol.H_COPY_STATUS));
    }

    static BlobDownloadInfo downloadInfo(HeaderStore h) {
        return new BlobDownloadInfo(
                BlobResponses.string(h, BlobProtocol.H_ETAG),
                BlobResponses.date(h, BlobProtocol.H_LAST_MODIFIED),
                BlobResponses.longValue(h, BlobProtocol.H_CONTENT_LENGTH, 0L),
                BlobResponses.string(h, BlobProtocol.H_CONTENT_RANGE),
                BlobType.fromValue(BlobResponses.string(h, BlobProtocol.H_BLOB_TYPE)),
                BlobResponses.httpHeaders(h),
                BlobResponses.metadata(h),
                BlobResponses.booleanValue(h, BlobProtocol.H_SERVER_ENCRYPTED),
                BlobResponses.string(h, BlobProtocol.H_ENCRYPTION_KEY_SHA256));
    }

    static void putIfPresent(HttpRequest.Builder request, String name, String value) {
        if (value != null) {
            request.header(name, value);
        }
    }
}
