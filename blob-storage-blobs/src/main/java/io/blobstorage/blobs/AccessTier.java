package io.blobstorage.blobs;

/**
 * Storage tier of a blob. Premium page blobs use the {@code P*} tiers; block blobs use
 * hot, cool and archive.
 */
public enum AccessTier {
    P4("P4"),
    P6("P6"),
    P10("P10"),
    P15("P15"),
    P20("P20"),
    P30("P30"),
    P40("P40"),
    P50("P50"),
    P60("P60"),
    P70("P70"),
    P80("P80"),
    HOT("Hot"),
    COOL("Cool"),
    ARCHIVE("Archive");

    private final String value;

    AccessTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** @return the matching tier, or {@code null} if absent or unknown */
    public static AccessTier fromValue(String value) {
        if (value == null) return null;
        for (AccessTier t : values()) {
            if (t.value.equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
