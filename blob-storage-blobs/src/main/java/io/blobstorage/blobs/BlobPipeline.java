package io.blobstorage.blobs;

import io.blobstorage.core.Context;
import io.blobstorage.core.HeaderStore;
import io.blobstorage.core.HttpRequest;
import io.blobstorage.core.Response;
import io.blobstorage.http.HttpTransport;
import io.blobstorage.http.HttpTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * Sends blob requests: stamps the service headers, applies the configured timeout and
 * turns non-success responses into {@link BlobStorageException}.
 *
 * <p>Shared by a client and every client derived from it.
 */
final class BlobPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(BlobPipeline.class);

    private final BlobClientOptions options;
    private final Clock clock;

    BlobPipeline(BlobClientOptions options) {
        this(options, Clock.systemUTC());
    }

    BlobPipeline(BlobClientOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    BlobClientOptions options() {
        return options;
    }

    /**
     * Sends the request. On success the caller owns the returned response; on failure the
     * error body is read and the response closed before the exception is thrown.
     */
    Response send(Context context, HttpRequest request) throws HttpTransportException {
        HttpRequest stamped = stamp(request);
        String clientRequestId = stamped.headers().get(BlobProtocol.H_CLIENT_REQUEST_ID);
        LOG.debug("{} {} (client request id {})", stamped.method(), stamped.uri(), clientRequestId);

        Response response = options.transport().send(context, stamped);
        if (response.isSuccess()) {
            return response;
        }
        throw toException(context, response);
    }

    /**
     * Sends a request whose answer is carried entirely in headers. The response body, if
     * any, is discarded.
     */
    HeaderStore sendForHeaders(Context context, HttpRequest request) throws HttpTransportException {
        Response response = send(context, request);
        try {
            return response.headers();
        } finally {
            closeQuietly(response);
        }
    }

    private HttpRequest stamp(HttpRequest request) {
        HttpRequest.Builder builder = request.toBuilder()
                .header(BlobProtocol.H_VERSION, options.apiVersion())
                .header(BlobProtocol.H_DATE, DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(clock.withZone(ZoneOffset.UTC))))
                .header(BlobProtocol.H_CLIENT_REQUEST_ID, UUID.randomUUID().toString());
        if (request.timeout() == null && options.timeout() != null) {
            builder.timeout(options.timeout());
        }
        return builder.build();
    }

    private static BlobStorageException toException(Context context, Response response) throws HttpTransportException {
        HeaderStore headers = response.headers();
        String body;
        try {
            body = new String(response.readBody(context), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HttpTransportException("Failed to read error response body (status " + response.statusCode() + ")", e);
        } finally {
            closeQuietly(response);
        }
        BlobStorageException e = new BlobStorageException(
                response.statusCode(),
                response.reasonPhrase(),
                headers.firstValue(BlobProtocol.H_ERROR_CODE).orElse(null),
                headers.firstValue(BlobProtocol.H_REQUEST_ID).orElse(null),
                body);
        LOG.debug("Request failed: {}", e.getMessage());
        return e;
    }

    static void closeQuietly(Response response) {
        try {
            response.close();
        } catch (IOException e) {
            LOG.warn("Failed to release response body", e);
        }
    }
}
