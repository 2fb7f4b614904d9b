package common;

import java.util.ArrayList;
import java.util.List;

/**
 * <h1>common.Observable</h1>
 * Instances of this class provide a way for clients to be notified when an event that intrigues them (clients) occurs.
 * One instance represents a single event category, whose occurrences carry a payload of type {@code T}.
 * To subscribe for the event, use {@link #on(Callback)} and {@link #once(Callback)}.
 *
 * <p> Registration and emission are safe to call from any thread.
 * Callbacks are invoked synchronously, in registration order, on the thread that emits the event
 *  and outside of this instance's lock, so a callback may register, remove or emit freely.
 *
 * @param <T> Type of the payload passed to the callbacks.
 */
public class Observable<T> {

    private final Object lock = new Object();
    /**
     * Registered callbacks, in registration order.
     */
    private final List<Registration> callbacks;

    public Observable() {
        callbacks = new ArrayList<>();
    }

    /**
     * Notify the observers (if any) of the occurrence of the event.
     * One-shot callbacks are removed before any callback is called.
     *
     * @param arg The payload to pass to observers' callback, may be null.
     */
    public void emitEvent(T arg) {
        List<Registration> snapshot;
        synchronized (lock) {
            if(callbacks.isEmpty())
                return;
            snapshot = new ArrayList<>(callbacks);
            // Since the callback could cause the same event to occur again, by emitting the same event,
            //  we have to remove one-shot callbacks first to make sure they won't be called more than once.
            callbacks.removeIf(registration -> registration.once);
        }
        snapshot.forEach(registration -> registration.callback.call(arg));
    }

    /**
     * Register a {@link Callback} that will be called by the {@code Observable} instance, <b>every time</b> the event occurs.
     * @see #once(Callback) To register a Callback that will only be called once.
     *
     * @param callback {@link Callback} instance that will be called every time when the event occurs.
     * @return {@link CallbackHandle} that can be used to remove the Callback.
     */
    public CallbackHandle on(Callback<? super T> callback) {
        return register(callback, false);
    }

    /**
     * Register a {@link Callback} that will only be called <b>once</b> by the {@code Observable} instance when the event occurs.
     * The Callback will not repeat once it is fired.
     * @see #on(Callback) to register a recurring Callback.
     *
     * @param callback {@link Callback} instance that will be called once when the event occurs.
     * @return {@link CallbackHandle} that can be used to remove the callback before it fires.
     */
    public CallbackHandle once(Callback<? super T> callback) {
        return register(callback, true);
    }

    private CallbackHandle register(Callback<? super T> callback, boolean once) {
        if(callback == null)
            throw new NullPointerException("callback");

        Registration registration = new Registration(callback, once);
        synchronized (lock) {
            callbacks.add(registration);
        }
        return () -> {
            synchronized (lock) {
                callbacks.remove(registration);
            }
        };
    }

    /**
     * Can be called to remove/unregister a specific Callback when the client is no longer interested in the event.
     * If the same callback was registered more than once, every registration of it is removed.
     *
     * @param callback The callback to remove.
     */
    public void removeListener(Callback<? super T> callback) {
        synchronized (lock) {
            callbacks.removeIf(registration -> registration.callback == callback);
        }
    }

    /**
     * Clears all the callbacks.
     */
    public void removeAllListeners() {
        synchronized (lock) {
            callbacks.clear();
        }
    }

    /**
     * @return Number of callbacks currently registered.
     */
    public int size() {
        synchronized (lock) {
            return callbacks.size();
        }
    }

    private final class Registration {

        private final Callback<? super T> callback;
        private final boolean once;

        private Registration(Callback<? super T> callback, boolean once) {
            this.callback = callback;
            this.once = once;
        }
    }

    /**
     * Wraps a single registration, so that a client can have a way to remove it when no longer interested.
     */
    @FunctionalInterface
    public interface CallbackHandle {

        /**
         * Remove the callback that this handle wraps. Does nothing if it was already removed or has fired once.
         */
        void remove();
    }

    /**
     * Implement this interface in order to register a callback to an Observable.
     * The {@link #call(Object)} method will be called when the event occurs, along with the event's payload.
     *
     * @param <T> Type of the payload.
     */
    @FunctionalInterface
    public interface Callback<T> {

        /**
         * Notify any interested parties by calling this method when the event it was registered for occurs.
         *
         * @param arg Payload of the event. May be null, for example for a disconnect without an error.
         */
        void call(T arg);
    }
}
