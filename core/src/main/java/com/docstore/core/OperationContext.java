package com.docstore.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * A cancellable deadline passed to every store operation.
 *
 * <p>Children inherit their parent's deadline and cancellation: a child's
 * deadline is never later than its parent's, and cancelling a parent cancels
 * every child. Closing a context cancels it, so a derived context can be
 * scoped with try-with-resources.
 *
 * <p>Work that blocks can register an {@link #onCancel(Runnable)} callback to
 * be aborted when the context, or any ancestor, is cancelled.
 */
public final class OperationContext implements AutoCloseable {
    private static final OperationContext BACKGROUND = new OperationContext(null, null, Clock.systemUTC(), false);

    private final OperationContext parent;
    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    private OperationContext(OperationContext parent, Instant deadline, Clock clock, boolean cancellable) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /**
     * @return the root context: no deadline, never cancelled
     */
    public static OperationContext background() {
        return BACKGROUND;
    }

    public static OperationContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static OperationContext withTimeout(Duration timeout, Clock clock) {
        return new OperationContext(null, clock.instant().plus(timeout), clock, true);
    }

    public static OperationContext withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static OperationContext withDeadline(Instant deadline, Clock clock) {
        return new OperationContext(null, deadline, clock, true);
    }

    /**
     * Derives a context that expires after {@code timeout} or at this context's
     * deadline, whichever comes first.
     */
    public OperationContext child(Duration timeout) {
        Instant candidate = clock.instant().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(candidate) ? deadline : candidate;
        OperationContext child = new OperationContext(this, effective, clock, true);
        Runnable propagate = child::cancel;
        onCancel(propagate);
        child.onCancel(() -> cancelListeners.remove(propagate));
        return child;
    }

    /**
     * Runs {@code listener} once this context or an ancestor is cancelled, or
     * straight away if it already is. Listeners on the background context are
     * never run.
     */
    public void onCancel(Runnable listener) {
        if (parent == null && !cancellable) {
            return;
        }
        cancelListeners.add(listener);
        if (isCancelled() && cancelListeners.remove(listener)) {
            listener.run();
        }
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * @return time left before the deadline, never negative; empty if there is no deadline
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public void cancel() {
        if (!cancellable || cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable listener : cancelListeners) {
            if (cancelListeners.remove(listener)) {
                listener.run();
            }
        }
    }

    /**
     * Throws unless the context is still live.
     *
     * @throws CancellationException if this context or an ancestor was cancelled
     * @throws DeadlineExceededException if the deadline has passed
     */
    public void ensureActive(String operation) {
        if (isCancelled()) {
            throw new CancellationException(operation + " cancelled");
        }
        if (isExpired()) {
            throw new DeadlineExceededException(operation + " exceeded its deadline of " + deadline);
        }
    }

    @Override
    public void close() {
        cancel();
    }

    /**
     * Unchecked carrier for a {@link TimeoutException}, so callers can inspect
     * the cause the same way for driver and context timeouts.
     */
    public static class DeadlineExceededException extends RuntimeException {
        public DeadlineExceededException(String message) {
            super(message, new TimeoutException(message));
        }
    }
}
