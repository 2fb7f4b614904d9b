package common;

import java.util.ArrayList;
import java.util.List;

/**
 * A one-way cancellation flag that carries the reason it was cancelled for.
 * Signals form a tree: a {@link #child()} is cancelled, with the same cause, as soon as its parent is.
 *
 * <p> {@link engineio_client.EngineSocket} uses a long lived signal for a whole reconnection lineage
 *  (the one given to {@code dial}) and one child signal per physical connection.
 */
public class CancelSignal {

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;
    private Throwable cause;

    /**
     * Cancel this signal and every child of it. Only the first call has an effect.
     * Listeners run on the calling thread.
     *
     * @param cause Why the signal was cancelled, may be null for an orderly cancellation.
     * @return true if this call cancelled the signal, false if it was already cancelled.
     */
    public boolean cancel(Throwable cause) {
        List<Runnable> toRun;
        synchronized (lock) {
            if(cancelled)
                return false;
            cancelled = true;
            this.cause = cause;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
        return true;
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    /**
     * @return The cause given to {@link #cancel(Throwable)}, null if not cancelled or cancelled without a cause.
     */
    public Throwable getCause() {
        synchronized (lock) {
            return cause;
        }
    }

    /**
     * Register a listener to run when this signal is cancelled.
     * If the signal is already cancelled, the listener runs right away on the calling thread.
     *
     * @param listener Listener to run once.
     * @return {@link Registration} that can be used to drop the listener before it runs.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (lock) {
            if(!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> {};
    }

    /**
     * Derive a signal that is cancelled along with this one, but can also be cancelled on its own
     *  without affecting this one.
     */
    public CancelSignal child() {
        CancelSignal child = new CancelSignal();
        Registration registration = onCancel(() -> child.cancel(getCause()));
        child.onCancel(registration::remove);
        return child;
    }

    @FunctionalInterface
    public interface Registration {

        /**
         * Drop the listener. Does nothing if it already ran.
         */
        void remove();
    }
}
