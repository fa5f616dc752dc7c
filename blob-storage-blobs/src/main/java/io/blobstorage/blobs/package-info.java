/**
 * Blob clients.
 *
 * <p>{@link io.blobstorage.blobs.BlobClient} covers the operations every blob supports;
 * {@link io.blobstorage.blobs.BlockBlobClient}, {@link io.blobstorage.blobs.AppendBlobClient}
 * and {@link io.blobstorage.blobs.PageBlobClient} add the type-specific ones. A subtype
 * client that shares another client's URI and pipeline can only be obtained through the
 * {@code get*Client()} conversions on {@code BlobClient}.
 *
 * <p>Every call is a single REST request, except the parallel downloads, which split
 * the blob into ranged requests. Service errors surface as
 * {@link io.blobstorage.blobs.BlobStorageException}.
 */
package io.blobstorage.blobs;
