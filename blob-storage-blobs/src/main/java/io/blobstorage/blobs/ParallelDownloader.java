package io.blobstorage.blobs;

import io.blobstorage.core.Context;
import io.blobstorage.core.OperationCancelledException;
import io.blobstorage.http.HttpTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads a blob as a series of ranged requests.
 *
 * <p>The first chunk is fetched on the calling thread and tells the total size. The rest
 * are fetched on a bounded pool, pinned to the first chunk's ETag so that a blob changed
 * mid-download fails instead of mixing versions.
 */
final class ParallelDownloader {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelDownloader.class);
    private static final int RANGE_NOT_SATISFIABLE = 416;

    /** Checked once the blob size is known, before anything is written. */
    interface SizeCheck {
        void accept(long size);
    }

    /** Receives chunk content; may be called from several threads for disjoint offsets. */
    interface ChunkSink {
        void write(long offset, byte[] data, int length) throws IOException;
    }

    private final BlobClient client;
    private final int chunkSize;
    private final int concurrency;

    ParallelDownloader(BlobClient client, int chunkSize, int concurrency) {
        this.client = Objects.requireNonNull(client, "client");
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0: " + chunkSize);
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0: " + concurrency);
        this.chunkSize = chunkSize;
        this.concurrency = concurrency;
    }

    BlobDownloadInfo download(Context context, SizeCheck sizeCheck, ChunkSink sink) throws HttpTransportException, IOException {
        Objects.requireNonNull(context, "context");
        BlobDownloadResponse first;
        try {
            first = client.download(new BlobRange(0, (long) chunkSize), null, context);
        } catch (BlobStorageException e) {
            if (e.statusCode() != RANGE_NOT_SATISFIABLE) throw e;
            // a range request against an empty blob
            return downloadWhole(context, sizeCheck, sink);
        }

        BlobDownloadInfo info;
        byte[] head;
        long total;
        try (first) {
            info = first.info();
            head = first.readBody(context);
            Long fromRange = BlobResponses.totalFromContentRange(first.rawResponse().headers());
            total = fromRange != null ? fromRange : head.length;
        }

        sizeCheck.accept(total);
        if (head.length > 0) {
            sink.write(0, head, head.length);
        }
        if (total > head.length) {
            downloadRemaining(context, info.eTag(), head.length, total, sink);
        }
        return info.withContentLength(total);
    }

    private BlobDownloadInfo downloadWhole(Context context, SizeCheck sizeCheck, ChunkSink sink) throws HttpTransportException, IOException {
        try (BlobDownloadResponse whole = client.download(null, null, context)) {
            byte[] data = whole.readBody(context);
            sizeCheck.accept(data.length);
            if (data.length > 0) {
                sink.write(0, data, data.length);
            }
            return whole.info().withContentLength(data.length);
        }
    }

    private void downloadRemaining(Context context, String eTag, long start, long total, ChunkSink sink)
            throws HttpTransportException, IOException {
        Context chunkContext = context.withCancellation();
        int chunks = (int) ((total - start + chunkSize - 1) / chunkSize);
        LOG.debug("Downloading {} bytes in {} more chunks of {}", total, chunks, chunkSize);

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, chunks), new ChunkThreadFactory());
        try {
            List<Future<Void>> futures = new ArrayList<>(chunks);
            for (long offset = start; offset < total; offset += chunkSize) {
                long chunkOffset = offset;
                long length = Math.min(chunkSize, total - offset);
                futures.add(pool.submit(() -> {
                    fetchChunk(chunkContext, eTag, chunkOffset, length, sink);
                    return null;
                }));
            }
            for (Future<Void> future : futures) {
                await(future, chunkContext);
            }
        } finally {
            chunkContext.cancel();
            pool.shutdownNow();
            awaitQuiet(pool);
        }
    }

    /**
     * Blocks until no chunk task is running, so that nothing writes to the sink once the
     * download has returned or thrown.
     */
    private static void awaitQuiet(ExecutorService pool) {
        try {
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                LOG.debug("Waiting for running download chunks to stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void fetchChunk(Context context, String eTag, long offset, long length, ChunkSink sink)
            throws HttpTransportException, IOException {
        context.throwIfCancelled();
        try (BlobDownloadResponse chunk = client.download(new BlobRange(offset, length), eTag, context)) {
            byte[] data = chunk.readBody(context);
            if (data.length != length) {
                throw new IOException("Expected " + length + " bytes at offset " + offset + " but received " + data.length);
            }
            sink.write(offset, data, data.length);
        }
    }

    private static void await(Future<Void> future, Context chunkContext) throws HttpTransportException, IOException {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            chunkContext.cancel();
            throw new OperationCancelledException("Interrupted while waiting for download chunks");
        } catch (ExecutionException e) {
            chunkContext.cancel();
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof HttpTransportException te) throw te;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IOException("Chunk download failed", cause);
        }
    }

    private static final class ChunkThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("blob-download-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
