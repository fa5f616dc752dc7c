package io.blobstorage.blobs;

/**
 * The service answered with a non-success status.
 *
 * <p>Carries the status code, the service error code from {@code x-ms-error-code}, the
 * service request id and the raw error body for diagnostics.
 */
public class BlobStorageException extends RuntimeException {

    private final int statusCode;
    private final String reasonPhrase;
    private final String errorCode;
    private final String requestId;
    private final String body;

    public BlobStorageException(int statusCode, String reasonPhrase, String errorCode, String requestId, String body) {
        super(buildMessage(statusCode, reasonPhrase, errorCode, requestId));
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.errorCode = errorCode;
        this.requestId = requestId;
        this.body = body;
    }

    public int statusCode() { return statusCode; }
    public String reasonPhrase() { return reasonPhrase; }
    /** Service error code such as {@code BlobNotFound}, or {@code null}. */
    public String errorCode() { return errorCode; }
    public String requestId() { return requestId; }
    /** Error body as text, empty when the service sent none. */
    public String body() { return body; }

    private static String buildMessage(int statusCode, String reasonPhrase, String errorCode, String requestId) {
        StringBuilder sb = new StringBuilder("Status code ").append(statusCode);
        if (reasonPhrase != null && !reasonPhrase.isEmpty()) sb.append(", \"").append(reasonPhrase).append('"');
        if (errorCode != null) sb.append(", error code ").append(errorCode);
        if (requestId != null) sb.append(", request id ").append(requestId);
        return sb.toString();
    }
}
