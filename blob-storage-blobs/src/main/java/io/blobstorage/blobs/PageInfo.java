package io.blobstorage.blobs;

import java.time.OffsetDateTime;

/**
 * Result of a page write or clear.
 */
public record PageInfo(String eTag, OffsetDateTime lastModified, String contentMd5, Long sequenceNumber) {}
