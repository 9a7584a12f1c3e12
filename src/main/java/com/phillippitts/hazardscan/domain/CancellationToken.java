package com.phillippitts.hazardscan.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal for one analysis call.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run exactly once, on the thread that
 * calls {@link #cancel()}, or immediately if the token was already cancelled.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe.
 */
public final class CancellationToken {

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    /** A token that is never cancelled by anyone but its holder. */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    /**
     * Registers a callback and returns a handle that unregisters it.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    /** Handle returned by {@link #onCancel(Runnable)}. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
