package io.blobstorage.http;

import io.blobstorage.core.Context;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.InputStreamBodyStream;
import io.blobstorage.core.MemoryBodyStream;
import io.blobstorage.core.Response;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpTransport} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpTransport implements HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(OkHttpTransport.class);

    private final OkHttpClient httpClient;

    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpTransport create() {
        return new OkHttpTransport(new OkHttpClient());
    }

    public static OkHttpTransport create(OkHttpClient httpClient) {
        return new OkHttpTransport(httpClient);
    }

    @Override
    public Response send(Context context, HttpRequest request) throws HttpTransportException {
        context.throwIfCancelled();
        LOG.debug("--> {} {}", request.method(), request.uri());
        okhttp3.Response okResponse = null;
        try {
            OkHttpClient client = clientWithTimeout(request);
            okResponse = client.newCall(toOkHttpRequest(request)).execute();
            Response response = toResponse(okResponse);
            LOG.debug("<-- {} {} {}", response.statusCode(), request.method(), request.uri());
            return response;
        } catch (InterruptedIOException e) {
            if (okResponse != null) okResponse.close();
            throw timeoutOrInterrupt(e);
        } catch (IOException e) {
            if (okResponse != null) okResponse.close();
            throw new HttpTransportException(e);
        }
    }

    /**
     * OkHttp reports socket read timeouts, call timeouts and thread interrupts alike as
     * {@link InterruptedIOException}. Only the first two are timeouts; an interrupt keeps
     * the thread's interrupt status set.
     */
    static HttpTransportException timeoutOrInterrupt(InterruptedIOException e) {
        if (Thread.currentThread().isInterrupted() || "interrupted".equals(e.getMessage())) {
            Thread.currentThread().interrupt();
            return new HttpTransportException("Request interrupted", e);
        }
        return new HttpTimeoutException(e);
    }

    private static Response toResponse(okhttp3.Response okResponse) throws IOException {
        Response response = new Response(okResponse.code(), okResponse.message());
        Headers headers = okResponse.headers();
        for (int i = 0; i < headers.size(); i++) {
            response.addHeader(headers.name(i), headers.value(i));
        }
        ResponseBody body = okResponse.body();
        if (body == null) {
            okResponse.close();
            response.setBodyStream(MemoryBodyStream.empty());
        } else {
            response.setBodyStream(new InputStreamBodyStream(body.byteStream(), body.contentLength(), okResponse));
        }
        return response;
    }

    private OkHttpClient clientWithTimeout(HttpRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.body() != null) {
            String contentType = request.headers().get("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "HEAD" -> builder.head();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "PUT" -> builder.put(body != null ? body : RequestBody.create(new byte[0], null));
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }
}
