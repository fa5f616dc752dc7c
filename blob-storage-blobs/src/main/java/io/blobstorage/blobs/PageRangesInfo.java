package io.blobstorage.blobs;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Result of {@link PageBlobClient#getPageRanges()}.
 *
 * @param pageRanges ranges holding data
 * @param clearRanges ranges that were cleared
 */
public record PageRangesInfo(
        String requestId,
        String version,
        String eTag,
        OffsetDateTime lastModified,
        long blobContentLength,
        List<PageRange> pageRanges,
        List<PageRange> clearRanges
) {
    public PageRangesInfo {
        pageRanges = List.copyOf(pageRanges);
        clearRanges = List.copyOf(clearRanges);
    }
}
