package io.blobstorage.core;

import java.util.concurrent.CancellationException;

/**
 * Raised when a {@link Context} is cancelled or its deadline passes while an
 * operation is in progress. Kept apart from {@link java.io.IOException} so that
 * callers can tell a stopped operation from a failed one.
 */
public class OperationCancelledException extends CancellationException {

    private final boolean deadlineExceeded;

    public OperationCancelledException(String message) {
        this(message, false);
    }

    public OperationCancelledException(String message, boolean deadlineExceeded) {
        super(message);
        this.deadlineExceeded = deadlineExceeded;
    }

    /** {@code true} when the cause was an expired deadline rather than an explicit cancel. */
    public boolean deadlineExceeded() {
        return deadlineExceeded;
    }
}
