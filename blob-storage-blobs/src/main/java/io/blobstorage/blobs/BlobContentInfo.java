package io.blobstorage.blobs;

import java.time.OffsetDateTime;

public record BlobContentInfo(
        String eTag,
        OffsetDateTime lastModified,
        String contentMd5,
        Long sequenceNumber,
        Boolean serverEncrypted
) {}
