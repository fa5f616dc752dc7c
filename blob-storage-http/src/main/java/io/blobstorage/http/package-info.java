/**
 * Transport SPI and its bindings.
 *
 * <p>{@link io.blobstorage.http.HttpTransport} turns an {@link io.blobstorage.core.HttpRequest}
 * into a streamed {@link io.blobstorage.core.Response}. Bindings are provided for the JDK
 * {@code HttpClient} (always available), OkHttp and Apache HttpClient 5 (optional
 * dependencies). {@link io.blobstorage.http.Http1ResponseReader} parses a raw HTTP/1.1
 * response off a byte stream.
 */
package io.blobstorage.http;
