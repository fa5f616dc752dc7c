package io.blobstorage.blobs;

/**
 * Blob service protocol constants (query keys, header names, and well-known values).
 */
public final class BlobProtocol {
    private BlobProtocol() {}

    public static final String DEFAULT_API_VERSION = "2019-12-12";

    /** Page blobs are written in units of this many bytes. */
    public static final long PAGE_SIZE = 512;

    // Query parameter keys
    public static final String Q_COMP = "comp";
    public static final String Q_SNAPSHOT = "snapshot";
    public static final String Q_COPY_ID = "copyid";

    // comp values
    public static final String COMP_PROPERTIES = "properties";
    public static final String COMP_METADATA = "metadata";
    public static final String COMP_TIER = "tier";
    public static final String COMP_COPY = "copy";
    public static final String COMP_SNAPSHOT = "snapshot";
    public static final String COMP_UNDELETE = "undelete";
    public static final String COMP_PAGE = "page";
    public static final String COMP_PAGE_LIST = "pagelist";
    public static final String COMP_INCREMENTAL_COPY = "incrementalcopy";
    public static final String COMP_APPEND_BLOCK = "appendblock";

    // Service headers
    public static final String H_VERSION = "x-ms-version";
    public static final String H_DATE = "x-ms-date";
    public static final String H_CLIENT_REQUEST_ID = "x-ms-client-request-id";
    public static final String H_REQUEST_ID = "x-ms-request-id";
    public static final String H_ERROR_CODE = "x-ms-error-code";
    public static final String H_BLOB_TYPE = "x-ms-blob-type";
    public static final String H_BLOB_CONTENT_LENGTH = "x-ms-blob-content-length";
    public static final String H_BLOB_CONTENT_TYPE = "x-ms-blob-content-type";
    public static final String H_BLOB_CONTENT_ENCODING = "x-ms-blob-content-encoding";
    public static final String H_BLOB_CONTENT_LANGUAGE = "x-ms-blob-content-language";
    public static final String H_BLOB_CONTENT_DISPOSITION = "x-ms-blob-content-disposition";
    public static final String H_BLOB_CONTENT_MD5 = "x-ms-blob-content-md5";
    public static final String H_BLOB_CACHE_CONTROL = "x-ms-blob-cache-control";
    public static final String H_BLOB_SEQUENCE_NUMBER = "x-ms-blob-sequence-number";
    public static final String H_BLOB_APPEND_OFFSET = "x-ms-blob-append-offset";
    public static final String H_BLOB_COMMITTED_BLOCK_COUNT = "x-ms-blob-committed-block-count";
    public static final String H_META_PREFIX = "x-ms-meta-";
    public static final String H_RANGE = "x-ms-range";
    public static final String H_SOURCE_RANGE = "x-ms-source-range";
    public static final String H_PAGE_WRITE = "x-ms-page-write";
    public static final String H_ACCESS_TIER = "x-ms-access-tier";
    public static final String H_COPY_SOURCE = "x-ms-copy-source";
    public static final String H_COPY_ID = "x-ms-copy-id";
    public static final String H_COPY_STATUS = "x-ms-copy-status";
    public static final String H_COPY_ACTION = "x-ms-copy-action";
    public static final String H_SNAPSHOT = "x-ms-snapshot";
    public static final String H_DELETE_SNAPSHOTS = "x-ms-delete-snapshots";
    public static final String H_SERVER_ENCRYPTED = "x-ms-server-encrypted";
    public static final String H_REQUEST_SERVER_ENCRYPTED = "x-ms-request-server-encrypted";
    public static final String H_ENCRYPTION_KEY_SHA256 = "x-ms-encryption-key-sha256";
    public static final String H_CREATION_TIME = "x-ms-creation-time";

    // HTTP headers
    public static final String H_ETAG = "ETag";
    public static final String H_LAST_MODIFIED = "Last-Modified";
    public static final String H_CONTENT_LENGTH = "Content-Length";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONTENT_ENCODING = "Content-Encoding";
    public static final String H_CONTENT_LANGUAGE = "Content-Language";
    public static final String H_CONTENT_DISPOSITION = "Content-Disposition";
    public static final String H_CONTENT_MD5 = "Content-MD5";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONTENT_RANGE = "Content-Range";

    // Well-known values
    public static final String PAGE_WRITE_UPDATE = "update";
    public static final String PAGE_WRITE_CLEAR = "clear";
    public static final String COPY_ACTION_ABORT = "abort";
    public static final String CT_OCTET_STREAM = "application/octet-stream";
}
