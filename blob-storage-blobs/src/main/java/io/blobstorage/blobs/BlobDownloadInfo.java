package io.blobstorage.blobs;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Describes downloaded blob content.
 *
 * @param contentLength bytes in this download: the range length for ranged downloads,
 *        the whole blob for {@code downloadTo*}
 * @param contentRange the {@code Content-Range} header of a ranged response, or {@code null}
 */
public record BlobDownloadInfo(
        String eTag,
        OffsetDateTime lastModified,
        long contentLength,
        String contentRange,
        BlobType blobType,
        BlobHttpHeaders httpHeaders,
        Map<String, String> metadata,
        Boolean serverEncrypted,
        String encryptionKeySha256
) {
    BlobDownloadInfo withContentLength(long length) {
        return new BlobDownloadInfo(eTag, lastModified, length, null, blobType, httpHeaders, metadata,
                serverEncrypted, encryptionKeySha256);
    }
}
