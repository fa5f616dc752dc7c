package io.blobstorage.blobs;

import java.time.OffsetDateTime;

/**
 * @param snapshot opaque snapshot id, usable with {@link BlobClient#withSnapshot(String)}
 */
public record BlobSnapshotInfo(String snapshot, String eTag, OffsetDateTime lastModified) {}
