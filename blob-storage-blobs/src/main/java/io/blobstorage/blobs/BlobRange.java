package io.blobstorage.blobs;

/**
 * A byte range of a blob.
 *
 * @param offset first byte, inclusive
 * @param length number of bytes, or {@code null} for "to the end of the blob"
 */
public record BlobRange(long offset, Long length) {
    public BlobRange {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
        if (length != null && length <= 0) throw new IllegalArgumentException("length must be > 0: " + length);
    }

    public static BlobRange from(long offset) {
        return new BlobRange(offset, null);
    }

    /** Value for the {@code x-ms-range} header. */
    public String toHeaderValue() {
        if (length == null) return "bytes=" + offset + "-";
        return "bytes=" + offset + "-" + (offset + length - 1);
    }
}
