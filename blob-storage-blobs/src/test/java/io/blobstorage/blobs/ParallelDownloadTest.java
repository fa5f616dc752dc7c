package io.blobstorage.blobs;

import io.blobstorage.core.Context;
import io.blobstorage.core.OperationCancelledException;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelDownloadTest {

    private static final int CHUNK = 1024;

    private MockWebServer server;
    private RangeDispatcher dispatcher;
    private BlobClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        dispatcher = new RangeDispatcher();
        server.setDispatcher(dispatcher);
        server.start();
        client = new BlobClient(server.url("/c/big.bin").toString(), BlobClientOptions.builder()
                .downloadChunkSize(CHUNK)
                .downloadConcurrency(3)
                .build());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private static byte[] randomBytes(int size) {
        byte[] data = new byte[size];
        new Random(42).nextBytes(data);
        return data;
    }

    @Test
    void downloadsIntoBufferAcrossChunks() throws Exception {
        byte[] blob = randomBytes(5 * CHUNK + 100);
        dispatcher.blob = blob;
        byte[] buffer = new byte[blob.length + 10];

        BlobDownloadInfo info = client.downloadToBuffer(buffer, Context.none());

        assertThat(info.contentLength()).isEqualTo(blob.length);
        assertThat(info.eTag()).isEqualTo(RangeDispatcher.ETAG);
        assertThat(Arrays.copyOf(buffer, blob.length)).isEqualTo(blob);
        assertThat(server.getRequestCount()).isEqualTo(6);
        assertThat(dispatcher.ranges).contains("bytes=0-1023", "bytes=5120-5219");
    }

    @Test
    void laterChunksArePinnedToTheFirstETag() throws Exception {
        dispatcher.blob = randomBytes(2 * CHUNK);

        client.downloadToBuffer(new byte[2 * CHUNK], Context.none());

        assertThat(dispatcher.ifMatch).containsExactly(RangeDispatcher.ETAG);
    }

    @Test
    void blobSmallerThanOneChunkNeedsOneRequest() throws Exception {
        byte[] blob = randomBytes(10);
        dispatcher.blob = blob;
        byte[] buffer = new byte[10];

        client.downloadToBuffer(buffer, Context.none());

        assertThat(buffer).isEqualTo(blob);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void emptyBlobIsAnsweredWith416AndDownloadsNothing() throws Exception {
        dispatcher.blob = new byte[0];

        BlobDownloadInfo info = client.downloadToBuffer(new byte[0], Context.none());

        assertThat(info.contentLength()).isZero();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void bufferTooSmallIsRejected() {
        dispatcher.blob = randomBytes(3 * CHUNK);

        assertThatThrownBy(() -> client.downloadToBuffer(new byte[CHUNK], Context.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too small");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void downloadsIntoFile(@TempDir Path dir) throws Exception {
        byte[] blob = randomBytes(4 * CHUNK + 1);
        dispatcher.blob = blob;
        Path file = dir.resolve("out.bin");
        Files.write(file, randomBytes(10 * CHUNK));

        BlobDownloadInfo info = client.downloadToFile(file, Context.none());

        assertThat(info.contentLength()).isEqualTo(blob.length);
        assertThat(Files.readAllBytes(file)).isEqualTo(blob);
    }

    @Test
    void failedChunkDeletesPartialFile(@TempDir Path dir) {
        dispatcher.blob = randomBytes(4 * CHUNK);
        dispatcher.failAtOffset = 2L * CHUNK;
        Path file = dir.resolve("out.bin");

        assertThatThrownBy(() -> client.downloadToFile(file, Context.none()))
                .isInstanceOfSatisfying(BlobStorageException.class, e -> assertThat(e.statusCode()).isEqualTo(500));
        assertThat(file).doesNotExist();
    }

    @Test
    void failedDownloadReturnsOnlyAfterRunningChunksStop() {
        dispatcher.blob = randomBytes(3 * CHUNK);
        dispatcher.failAtOffset = CHUNK;
        dispatcher.failDelayMillis = 300;
        AtomicBoolean slowWriteDone = new AtomicBoolean();
        ParallelDownloader downloader = new ParallelDownloader(client, CHUNK, 3);

        assertThatThrownBy(() -> downloader.download(Context.none(), size -> {}, (offset, data, length) -> {
            if (offset == 2L * CHUNK) {
                sleepIgnoringInterrupts(1000);
                slowWriteDone.set(true);
            }
        })).isInstanceOfSatisfying(BlobStorageException.class, e -> assertThat(e.statusCode()).isEqualTo(500));

        assertThat(slowWriteDone).isTrue();
    }

    private static void sleepIgnoringInterrupts(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        boolean interrupted = false;
        long left;
        while ((left = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(left);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void cancelledContextStopsTheDownload() {
        dispatcher.blob = randomBytes(4 * CHUNK);
        Context context = Context.none().withCancellation();
        context.cancel();

        assertThatThrownBy(() -> client.downloadToBuffer(new byte[4 * CHUNK], context))
                .isInstanceOf(OperationCancelledException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    /** Serves {@link #blob} honouring {@code x-ms-range}. */
    private static final class RangeDispatcher extends Dispatcher {
        static final String ETAG = "\"0xETAG\"";

        volatile byte[] blob = new byte[0];
        volatile long failAtOffset = -1;
        volatile long failDelayMillis;
        final List<String> ranges = Collections.synchronizedList(new ArrayList<>());
        final List<String> ifMatch = Collections.synchronizedList(new ArrayList<>());

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String range = request.getHeader("x-ms-range");
            String match = request.getHeader("If-Match");
            if (match != null) ifMatch.add(match);
            if (range == null) {
                return new MockResponse()
                        .addHeader("ETag", ETAG)
                        .setBody(new Buffer().write(blob));
            }
            ranges.add(range);
            String[] bounds = range.substring("bytes=".length()).split("-");
            long start = Long.parseLong(bounds[0]);
            long end = Math.min(Long.parseLong(bounds[1]), blob.length - 1L);
            if (start == failAtOffset) {
                return new MockResponse()
                        .setResponseCode(500)
                        .addHeader("x-ms-error-code", "InternalError")
                        .setHeadersDelay(failDelayMillis, TimeUnit.MILLISECONDS);
            }
            if (start >= blob.length) {
                return new MockResponse()
                        .setResponseCode(416)
                        .addHeader("x-ms-error-code", "InvalidRange");
            }
            byte[] slice = Arrays.copyOfRange(blob, (int) start, (int) end + 1);
            return new MockResponse()
                    .setResponseCode(206)
                    .addHeader("ETag", ETAG)
                    .addHeader("Content-Range", "bytes " + start + "-" + end + "/" + blob.length)
                    .setBody(new Buffer().write(slice));
        }
    }
}
