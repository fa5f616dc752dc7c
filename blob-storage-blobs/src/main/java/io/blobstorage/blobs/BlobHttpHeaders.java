package io.blobstorage.blobs;

/**
 * Standard HTTP properties stored with a blob and returned on download.
 * Any component may be {@code null}.
 *
 * @param contentMd5 base64 MD5 of the blob content
 */
public record BlobHttpHeaders(
        String contentType,
        String contentEncoding,
        String contentLanguage,
        String contentDisposition,
        String cacheControl,
        String contentMd5
) {
    public static BlobHttpHeaders empty() {
        return new BlobHttpHeaders(null, null, null, null, null, null);
    }

    public BlobHttpHeaders withContentType(String contentType) {
        return new BlobHttpHeaders(contentType, contentEncoding, contentLanguage, contentDisposition, cacheControl, contentMd5);
    }
}
