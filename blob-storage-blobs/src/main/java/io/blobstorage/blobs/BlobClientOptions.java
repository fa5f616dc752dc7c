package io.blobstorage.blobs;

import io.blobstorage.http.HttpTransport;
import io.blobstorage.http.JdkHttpTransport;

import java.time.Duration;
import java.util.Objects;

/**
 * Client configuration shared by every request a blob client sends.
 * Immutable; use {@link #builder()}.
 */
public final class BlobClientOptions {

    static final int DEFAULT_CHUNK_SIZE = 4 * 1024 * 1024;
    static final int DEFAULT_CONCURRENCY = 4;

    private final HttpTransport transport;
    private final String apiVersion;
    private final Duration timeout;
    private final int downloadChunkSize;
    private final int downloadConcurrency;

    private BlobClientOptions(Builder builder) {
        this.transport = builder.transport != null ? builder.transport : JdkHttpTransport.create();
        this.apiVersion = builder.apiVersion;
        this.timeout = builder.timeout;
        this.downloadChunkSize = builder.downloadChunkSize;
        this.downloadConcurrency = builder.downloadConcurrency;
    }

    public static BlobClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public HttpTransport transport() { return transport; }
    public String apiVersion() { return apiVersion; }
    /** Per-request timeout, or {@code null} for the transport default. */
    public Duration timeout() { return timeout; }
    public int downloadChunkSize() { return downloadChunkSize; }
    public int downloadConcurrency() { return downloadConcurrency; }

    public static final class Builder {
        private HttpTransport transport;
        private String apiVersion = BlobProtocol.DEFAULT_API_VERSION;
        private Duration timeout;
        private int downloadChunkSize = DEFAULT_CHUNK_SIZE;
        private int downloadConcurrency = DEFAULT_CONCURRENCY;

        private Builder() {}

        public Builder transport(HttpTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        /** Size of each ranged request made by the parallel downloads. */
        public Builder downloadChunkSize(int bytes) {
            if (bytes <= 0) throw new IllegalArgumentException("downloadChunkSize must be > 0: " + bytes);
            this.downloadChunkSize = bytes;
            return this;
        }

        /** Maximum number of ranged requests in flight during a parallel download. */
        public Builder downloadConcurrency(int concurrency) {
            if (concurrency <= 0) throw new IllegalArgumentException("downloadConcurrency must be > 0: " + concurrency);
            this.downloadConcurrency = concurrency;
            return this;
        }

        public BlobClientOptions build() {
            return new BlobClientOptions(this);
        }
    }
}
