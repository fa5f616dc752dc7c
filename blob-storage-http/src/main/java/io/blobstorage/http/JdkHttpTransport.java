package io.blobstorage.http;

import io.blobstorage.core.Context;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.InputStreamBodyStream;
import io.blobstorage.core.ReasonPhrases;
import io.blobstorage.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HttpTransport} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is configured.
 *
 * <p>The JDK client does not expose the reason phrase sent by the server; the standard
 * phrase for the status code is used instead.
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new transport with a default HttpClient.
     * @return a new JdkHttpTransport
     */
    public static JdkHttpTransport create() {
        return new JdkHttpTransport(HttpClient.newHttpClient());
    }

    /**
     * Creates a new transport with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpTransport
     */
    public static JdkHttpTransport create(HttpClient httpClient) {
        return new JdkHttpTransport(httpClient);
    }

    @Override
    public Response send(Context context, HttpRequest request) throws HttpTransportException {
        context.throwIfCancelled();
        LOG.debug("--> {} {}", request.method(), request.uri());
        try {
            java.net.http.HttpRequest jdkRequest = toJdkRequest(request);
            HttpResponse<InputStream> jdkResponse = httpClient.send(jdkRequest, HttpResponse.BodyHandlers.ofInputStream());
            Response response = toResponse(request.method(), jdkResponse);
            LOG.debug("<-- {} {} {}", response.statusCode(), request.method(), request.uri());
            return response;
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpTransportException("Request interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpTransportException(e);
        }
    }

    private static Response toResponse(String method, HttpResponse<InputStream> jdkResponse) throws IOException {
        int status = jdkResponse.statusCode();
        Response response = new Response(status, ReasonPhrases.of(status));
        for (Map.Entry<String, List<String>> e : jdkResponse.headers().map().entrySet()) {
            // HTTP/2 pseudo headers
            if (e.getKey().startsWith(":")) continue;
            for (String value : e.getValue()) {
                response.addHeader(e.getKey(), value);
            }
        }
        // Content-Length of a bodiless response describes the entity, not these bytes
        long length = hasNoBody(method, status)
                ? -1L
                : jdkResponse.headers().firstValueAsLong("Content-Length").orElse(-1L);
        response.setBodyStream(new InputStreamBodyStream(jdkResponse.body(), length));
        return response;
    }

    private static boolean hasNoBody(String method, int status) {
        return "HEAD".equalsIgnoreCase(method) || status < 200 || status == 204 || status == 304;
    }

    private static java.net.http.HttpRequest toJdkRequest(HttpRequest request) {
        java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder(request.uri());

        java.net.http.HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? java.net.http.HttpRequest.BodyPublishers.noBody()
                : java.net.http.HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }
}
