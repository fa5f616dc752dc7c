package io.blobstorage.blobs;

/**
 * A run of pages, expressed as offset and length in bytes.
 */
public record PageRange(long offset, long length) {}
