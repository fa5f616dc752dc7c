package io.blobstorage.http;

import io.blobstorage.core.Context;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.Response;

/**
 * Abstraction over HTTP client implementations.
 *
 * <p>This interface lets the blob clients work with different HTTP client libraries
 * (JDK HttpClient, OkHttp, Apache HttpClient) without a direct dependency on any of them.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpTransport transport = JdkHttpTransport.create();
 * HttpRequest request = HttpRequest.get(URI.create("https://account.blob.example.net/c/b")).build();
 * try (Response response = transport.send(Context.none(), request)) {
 *     byte[] body = response.readBody(Context.none());
 * }
 * }</pre>
 */
public interface HttpTransport {

    /**
     * Sends a request and returns once the status line and headers have arrived.
     *
     * <p>The body is not read: it is attached to the returned response as a
     * {@link io.blobstorage.core.BodyStream} that still holds the connection. The caller
     * is responsible for closing the response or the body taken from it.
     *
     * @param context checked for cancellation before the request is sent
     * @param request the HTTP request to send
     * @return the response with a streamed body
     * @throws HttpTransportException if the request fails
     * @throws HttpTimeoutException if the request times out
     * @throws io.blobstorage.core.OperationCancelledException if {@code context} is cancelled
     */
    Response send(Context context, HttpRequest request) throws HttpTransportException;
}
