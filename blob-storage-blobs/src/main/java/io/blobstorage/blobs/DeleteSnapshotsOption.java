package io.blobstorage.blobs;

/**
 * What to do with a blob's snapshots when the blob is deleted.
 */
public enum DeleteSnapshotsOption {
    /** Send no option; the service refuses to delete a blob that has snapshots. */
    NONE(null),
    /** Delete the blob and all of its snapshots. */
    INCLUDE("include"),
    /** Delete only the snapshots. */
    ONLY("only");

    private final String value;

    DeleteSnapshotsOption(String value) {
        this.value = value;
    }

    String value() {
        return value;
    }
}
