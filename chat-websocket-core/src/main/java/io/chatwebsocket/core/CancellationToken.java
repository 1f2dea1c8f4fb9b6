package io.chatwebsocket.core;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed into long-running calls.
 *
 * <p>Cancellation is one-way: once requested it stays requested. Listeners registered after
 * cancellation run immediately on the registering thread; listeners registered before run once
 * on the thread that calls {@link #cancel()}.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a new token that can be cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Returns a shared token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Requests cancellation and notifies the registered listeners. Subsequent calls are no-ops.
     *
     * @throws UnsupportedOperationException on {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        listeners.clear();
    }

    /**
     * Registers a listener for cancellation.
     *
     * @param listener callback to run when cancellation is requested
     * @return a registration that detaches the listener when closed
     */
    public Registration onCancellationRequested(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        if (!cancellable) {
            return Registration.noop();
        }
        if (cancelled.get()) {
            listener.run();
            return Registration.noop();
        }
        Runnable entry = once(listener);
        listeners.add(entry);
        if (cancelled.get()) {
            // cancel() may have taken its snapshot before the add
            listeners.remove(entry);
            entry.run();
        }
        return () -> listeners.remove(entry);
    }

    private static Runnable once(Runnable listener) {
        AtomicBoolean ran = new AtomicBoolean();
        return () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
    }

    /**
     * Number of listeners still attached.
     */
    public int listenerCount() {
        return listeners.size();
    }
}
