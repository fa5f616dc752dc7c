package io.blobstorage.blobs;

public enum BlobType {
    BLOCK_BLOB("BlockBlob"),
    PAGE_BLOB("PageBlob"),
    APPEND_BLOB("AppendBlob"),
    UNKNOWN("");

    private final String value;

    BlobType(String value) {
        this.value = value;
    }

    /** Wire value, e.g. {@code PageBlob}. */
    public String value() {
        return value;
    }

    public static BlobType fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (BlobType t : values()) {
            if (t != UNKNOWN && t.value.equalsIgnoreCase(value.trim())) return t;
        }
        return UNKNOWN;
    }
}
