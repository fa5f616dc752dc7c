package io.blobstorage.http;

/**
 * Exception thrown when an HTTP exchange fails before a response is available.
 * Wraps underlying implementation-specific exceptions.
 */
public class HttpTransportException extends Exception {

    public HttpTransportException(String message) {
        super(message);
    }

    public HttpTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpTransportException(Throwable cause) {
        super(cause);
    }
}
