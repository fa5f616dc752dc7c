package io.blobstorage.blobs;

import java.time.OffsetDateTime;

/**
 * @param appendOffset offset at which the block was committed
 * @param committedBlockCount number of committed blocks after the append
 */
public record BlobAppendInfo(String eTag, OffsetDateTime lastModified, long appendOffset, long committedBlockCount) {}
