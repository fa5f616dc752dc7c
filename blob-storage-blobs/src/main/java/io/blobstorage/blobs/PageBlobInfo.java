package io.blobstorage.blobs;

import java.time.OffsetDateTime;

/**
 * Result of {@link PageBlobClient#resize(long)}.
 */
public record PageBlobInfo(String eTag, OffsetDateTime lastModified, Long sequenceNumber) {}
