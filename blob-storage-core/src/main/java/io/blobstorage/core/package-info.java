/**
 * HTTP response model shared by every blob-storage client call.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>{@link io.blobstorage.core.Response} with its {@link io.blobstorage.core.HeaderStore}</li>
 *   <li>The single-pass {@link io.blobstorage.core.BodyStream} contract and its implementations</li>
 *   <li>The {@link io.blobstorage.core.Context} cancellation token</li>
 *   <li>The immutable {@link io.blobstorage.core.HttpRequest} value type</li>
 * </ul>
 *
 * <p>HTTP client bindings live in {@code blob-storage-http}.
 */
package io.blobstorage.core;
