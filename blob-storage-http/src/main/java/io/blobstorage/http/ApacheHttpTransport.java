package io.blobstorage.http;

import io.blobstorage.core.Context;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.InputStreamBodyStream;
import io.blobstorage.core.MemoryBodyStream;
import io.blobstorage.core.Response;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.routing.RoutingSupport;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpTransport} implementation using Apache HttpClient 5.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath.
 * The connection stays leased until the response body is closed.
 */
public final class ApacheHttpTransport implements HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(ApacheHttpTransport.class);

    private final CloseableHttpClient httpClient;

    public ApacheHttpTransport(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheHttpTransport create() {
        return new ApacheHttpTransport(HttpClients.createDefault());
    }

    public static ApacheHttpTransport create(CloseableHttpClient httpClient) {
        return new ApacheHttpTransport(httpClient);
    }

    @Override
    public Response send(Context context, HttpRequest request) throws HttpTransportException {
        context.throwIfCancelled();
        LOG.debug("--> {} {}", request.method(), request.uri());
        try {
            HttpUriRequestBase apacheRequest = toApacheRequest(request);
            ClassicHttpResponse apacheResponse = httpClient.executeOpen(
                    RoutingSupport.determineHost(apacheRequest), apacheRequest, null);
            Response response = toResponse(apacheResponse);
            LOG.debug("<-- {} {} {}", response.statusCode(), request.method(), request.uri());
            return response;
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (IOException | HttpException e) {
            throw new HttpTransportException(e);
        }
    }

    static Response toResponse(ClassicHttpResponse apacheResponse) throws IOException {
        Response response = new Response(apacheResponse.getCode(), apacheResponse.getReasonPhrase());
        for (Header h : apacheResponse.getHeaders()) {
            response.addHeader(h.getName(), h.getValue());
        }
        HttpEntity entity = apacheResponse.getEntity();
        if (entity == null) {
            apacheResponse.close();
            response.setBodyStream(MemoryBodyStream.empty());
        } else {
            InputStream content;
            try {
                content = entity.getContent();
            } catch (IOException | RuntimeException e) {
                // the connection stays leased until the response is closed
                try {
                    apacheResponse.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
            response.setBodyStream(new InputStreamBodyStream(content, entity.getContentLength(), apacheResponse));
        }
        return response;
    }

    private static HttpUriRequestBase toApacheRequest(HttpRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        if (request.body() != null) {
            String contentType = request.headers().get("Content-Type");
            apacheRequest.setEntity(new ByteArrayEntity(request.body(),
                    contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM));
        }

        request.headers().forEach((name, value) -> {
            if (!"Content-Type".equalsIgnoreCase(name)) {
                apacheRequest.setHeader(name, value);
            }
        });

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }
}
