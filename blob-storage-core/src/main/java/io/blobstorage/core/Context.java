package io.blobstorage.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cancellation token passed down to blocking operations.
 *
 * <p>Contexts form a chain: a derived context is cancelled when it, or any of its
 * ancestors, is cancelled or past its deadline. {@link #cancel()} may be called
 * from any thread; the flag is observed the next time an operation checks it.
 *
 * <pre>{@code
 * Context ctx = Context.none().withTimeout(Duration.ofSeconds(30));
 * byte[] bytes = response.readBody(ctx);
 * }</pre>
 */
public final class Context {

    private static final Context NONE = new Context(null, null, Clock.systemUTC(), false);

    private final Context parent;
    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;
    private volatile boolean cancelled;

    private Context(Context parent, Instant deadline, Clock clock, boolean cancellable) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /** The root context. It is never cancelled and has no deadline. */
    public static Context none() {
        return NONE;
    }

    /** A child that can be cancelled independently of this context. */
    public Context withCancellation() {
        return new Context(this, null, clock, true);
    }

    /** A cancellable child that also expires at {@code deadline}. */
    public Context withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        return new Context(this, deadline, clock, true);
    }

    public Context withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return withDeadline(clock.instant().plus(timeout));
    }

    Context withClock(Clock clock) {
        return new Context(this, null, Objects.requireNonNull(clock, "clock"), true);
    }

    /**
     * Cancels this context and every context derived from it.
     *
     * @throws UnsupportedOperationException on {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("the root context cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        for (Context c = this; c != null; c = c.parent) {
            if (c.cancelled) return true;
            if (c.deadline != null && !clock.instant().isBefore(c.deadline)) return true;
        }
        return false;
    }

    /** Earliest deadline along the chain, or {@code null}. */
    public Instant deadline() {
        Instant earliest = null;
        for (Context c = this; c != null; c = c.parent) {
            if (c.deadline != null && (earliest == null || c.deadline.isBefore(earliest))) {
                earliest = c.deadline;
            }
        }
        return earliest;
    }

    /**
     * @throws OperationCancelledException if this context is cancelled or expired
     */
    public void throwIfCancelled() {
        for (Context c = this; c != null; c = c.parent) {
            if (c.cancelled) {
                throw new OperationCancelledException("operation cancelled");
            }
            if (c.deadline != null && !clock.instant().isBefore(c.deadline)) {
                throw new OperationCancelledException("deadline exceeded at " + c.deadline, true);
            }
        }
    }
}
