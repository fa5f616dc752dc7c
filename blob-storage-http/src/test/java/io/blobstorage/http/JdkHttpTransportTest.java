package io.blobstorage.http;

import io.blobstorage.core.Context;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.Response;
import okhttp3.mockwebserver.MockResponse;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JdkHttpTransportTest extends HttpTransportContractTest {

    @Override
    protected HttpTransport newTransport() {
        return JdkHttpTransport.create();
    }

    @Test
    void usesStandardReasonPhrase() throws Exception {
        server.enqueue(new MockResponse().setStatus("HTTP/1.1 404 The specified blob does not exist."));

        try (Response response = transport.send(Context.none(), HttpRequest.get(uri("/c/b")).build())) {
            assertThat(response.reasonPhrase()).isEqualTo("Not Found");
        }
    }

    @Test
    void headResponseHasNoLengthHint() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Length", "1024"));

        try (Response response = transport.send(Context.none(), HttpRequest.head(uri("/c/b")).build())) {
            assertThat(response.headers().firstValue("Content-Length")).contains("1024");
            assertThat(response.bodyStream().length()).isEqualTo(-1);
            assertThat(response.readBody(Context.none())).isEmpty();
        }
    }

    @Test
    void getResponseLengthHintComesFromContentLength() throws Exception {
        server.enqueue(new MockResponse().setBody("0123456789"));

        try (Response response = transport.send(Context.none(), HttpRequest.get(uri("/c/b")).build())) {
            assertThat(response.bodyStream().length()).isEqualTo(10);
        }
    }
}
