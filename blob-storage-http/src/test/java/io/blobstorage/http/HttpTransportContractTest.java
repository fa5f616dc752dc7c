package io.blobstorage.http;

import io.blobstorage.core.Context;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.OperationCancelledException;
import io.blobstorage.core.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link HttpTransport} binding has to share.
 */
abstract class HttpTransportContractTest {

    protected MockWebServer server;
    protected HttpTransport transport;

    protected abstract HttpTransport newTransport();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        transport = newTransport();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void streamsStatusHeadersAndBody() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("ETag", "\"0x1\"")
                .addHeader("x-ms-meta-tag", "one")
                .addHeader("x-ms-meta-tag", "two")
                .setBody("payload"));

        try (Response response = transport.send(Context.none(), HttpRequest.get(uri("/c/b")).build())) {
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("etag")).contains("\"0x1\"");
            assertThat(response.headers().values("X-MS-META-TAG")).containsExactly("one", "two");
            assertThat(new String(response.readBody(Context.none()), StandardCharsets.UTF_8)).isEqualTo("payload");
        }
    }

    @Test
    void sendsMethodHeadersAndBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        HttpRequest request = HttpRequest.put(uri("/c/b?comp=page"))
                .header("x-ms-page-write", "update")
                .header("Content-Type", "application/octet-stream")
                .body(new byte[]{1, 2, 3})
                .build();
        try (Response response = transport.send(Context.none(), request)) {
            assertThat(response.statusCode()).isEqualTo(201);
        }

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("PUT");
        assertThat(recorded.getPath()).isEqualTo("/c/b?comp=page");
        assertThat(recorded.getHeader("x-ms-page-write")).isEqualTo("update");
        assertThat(recorded.getBody().readByteArray()).containsExactly(1, 2, 3);
    }

    @Test
    void headResponseHasEmptyBody() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("x-ms-blob-type", "PageBlob"));

        try (Response response = transport.send(Context.none(), HttpRequest.head(uri("/c/b")).build())) {
            assertThat(response.headers().firstValue("x-ms-blob-type")).contains("PageBlob");
            assertThat(response.readBody(Context.none())).isEmpty();
        }
    }

    @Test
    void errorStatusIsAResponseNotAnException() throws Exception {
        server.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 404 The specified blob does not exist.")
                .addHeader("x-ms-error-code", "BlobNotFound"));

        try (Response response = transport.send(Context.none(), HttpRequest.get(uri("/c/missing")).build())) {
            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.isSuccess()).isFalse();
            assertThat(response.headers().firstValue("x-ms-error-code")).contains("BlobNotFound");
        }
    }

    @Test
    void cancelledContextSendsNothing() {
        Context ctx = Context.none().withCancellation();
        ctx.cancel();

        assertThatThrownBy(() -> transport.send(ctx, HttpRequest.get(uri("/c/b")).build()))
                .isInstanceOf(OperationCancelledException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void slowResponseTimesOut() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeadersDelay(2, TimeUnit.SECONDS));

        HttpRequest request = HttpRequest.get(uri("/c/slow")).timeout(Duration.ofMillis(200)).build();

        assertThatThrownBy(() -> transport.send(Context.none(), request))
                .isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void connectionFailureIsATransportException() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        URI unreachable = URI.create("http://localhost:" + port + "/c/b");

        assertThatThrownBy(() -> transport.send(Context.none(), HttpRequest.get(unreachable).build()))
                .isInstanceOf(HttpTransportException.class);
    }

    protected URI uri(String path) {
        return server.url(path).uri();
    }
}
