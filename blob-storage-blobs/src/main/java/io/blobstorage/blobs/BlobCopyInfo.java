package io.blobstorage.blobs;

import java.time.OffsetDateTime;

/**
 * State of a copy started with {@link BlobClient#startCopyFromUri(String)} or
 * {@link PageBlobClient#startCopyIncremental(String)}.
 *
 * @param copyStatus {@code pending}, {@code success}, {@code aborted} or {@code failed}
 */
public record BlobCopyInfo(String eTag, OffsetDateTime lastModified, String copyId, String copyStatus) {}
