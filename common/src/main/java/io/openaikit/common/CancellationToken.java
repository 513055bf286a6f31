package io.openaikit.common;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation flag shared by every suspended step of one call.
 * <p>
 * A token starts out not cancelled and moves to cancelled at most once; the transition is
 * never undone. Readers poll {@link #isCancelled()} at their suspension points (before each
 * frame read, before each backoff wait). Resources that can block, such as an open response
 * stream or a pending delay, register a listener with {@link #onCancel(Runnable)} so that a
 * cancel request also unblocks them.
 * <p>
 * A cancelled token cannot be reset. Retrying a cancelled call requires a new token.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CompletableFuture<ResultStream> call = client.stream(envelope, ResponsesDeltaMapping.FACTORY, token);
 * // later, from any thread
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {

    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

    private static final Registration NO_REGISTRATION = () -> { };

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean cancelled;

    /**
     * Returns a token that is never cancelled by anyone but its holder.
     *
     * @return a new, independent token
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Creates a child token that is cancelled whenever {@code parent} is. Cancelling the child
     * leaves the parent untouched.
     *
     * @param parent the token to follow
     * @return a new child token
     */
    public static CancellationToken linkedTo(CancellationToken parent) {
        CancellationToken child = new CancellationToken();
        Registration registration = parent.onCancel(child::cancel);
        child.onCancel(registration::close);
        return child;
    }

    /**
     * @return {@code true} once {@link #cancel()} has been called
     */
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Requests cancellation. The first call runs every registered listener on the calling
     * thread; later calls do nothing.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        LOGGER.debug("Cancellation requested, notifying {} listener(s)", toRun.size());
        for (Runnable listener : toRun) {
            runListener(listener);
        }
    }

    /**
     * Registers a listener to run on cancellation. If the token is already cancelled the
     * listener runs immediately on the calling thread.
     *
     * @param listener the action to run once
     * @return a handle that unregisters the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        synchronized (lock) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        runListener(listener);
        return NO_REGISTRATION;
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            // remaining listeners still run
            LOGGER.warn("Cancellation listener failed", e);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + cancelled + "]";
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
