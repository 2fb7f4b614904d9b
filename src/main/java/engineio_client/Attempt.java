package engineio_client;

import common.CancelSignal;
import common.Worker;
import engineio_client.transports.Transport;

import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * One physical connection of an {@link EngineSocket}.
 * Everything started for a connection (reader loop, ping watchdog, forced close) holds on to its Attempt,
 *  and the socket ignores requests coming from an attempt that is no longer the current one.
 *
 * <p> Cancelling {@link #signal} stops the watchdog and the forced close, and closes the transport connection.
 */
final class Attempt {

    final long generation;
    final Transport.Connection connection;
    final CancelSignal signal;
    final PingWatchdog watchdog;
    // Guarded by the EngineSocket lock.
    boolean tornDown;
    private ScheduledFuture<?> forcedClose;

    Attempt(long generation, Transport.Connection connection, CancelSignal signal, Consumer<Attempt> onPingTimeout) {
        this.generation = generation;
        this.connection = connection;
        this.signal = signal;
        this.watchdog = new PingWatchdog(() -> onPingTimeout.accept(this));
        signal.onCancel(this::release);
    }

    /**
     * Run {@code task} after {@code delayMillis}, unless the attempt ends first. Only one forced close is kept.
     */
    synchronized void scheduleForcedClose(Runnable task, long delayMillis) {
        if(signal.isCancelled() || forcedClose != null)
            return;
        forcedClose = Worker.schedule(() -> Worker.execute(task), delayMillis);
    }

    private void release() {
        watchdog.stop();
        synchronized (this) {
            if(forcedClose != null)
                forcedClose.cancel(false);
        }
        connection.close();
    }

    @Override
    public String toString() {
        return "Attempt{generation=" + generation + '}';
    }
}
