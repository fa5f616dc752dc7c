package io.blobstorage.blobs;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Properties and metadata returned by {@link BlobClient#getProperties()}.
 *
 * @param metadata user metadata from {@code x-ms-meta-*}, names as the service sent them
 * @param sequenceNumber page blob sequence number, {@code null} for other blob types
 * @param committedBlockCount append blob block count, {@code null} for other blob types
 */
public record BlobProperties(
        String eTag,
        OffsetDateTime lastModified,
        OffsetDateTime creationTime,
        long contentLength,
        BlobType blobType,
        BlobHttpHeaders httpHeaders,
        Map<String, String> metadata,
        Boolean serverEncrypted,
        String encryptionKeySha256,
        AccessTier accessTier,
        String copyId,
        String copyStatus,
        Long sequenceNumber,
        Long committedBlockCount
) {}
