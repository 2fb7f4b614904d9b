package engineio_client;

import common.Worker;

import java.util.concurrent.ScheduledFuture;

/**
 * Closes a connection when the server stays silent for too long.
 * The watchdog stays idle until {@link #start(long)} is called after the handshake,
 *  then every {@link #reset(long)} pushes the deadline back. Once stopped it can't be started again.
 */
class PingWatchdog {

    private final Runnable onTimeout;
    private ScheduledFuture<?> timeoutFuture;
    private boolean started;
    private boolean stopped;

    PingWatchdog(Runnable onTimeout) {
        this.onTimeout = onTimeout;
    }

    synchronized void start(long timeoutMillis) {
        if(stopped)
            return;
        started = true;
        rearm(timeoutMillis);
    }

    /**
     * Push the deadline to {@code timeoutMillis} from now. Does nothing before {@link #start(long)}.
     */
    synchronized void reset(long timeoutMillis) {
        if(started && !stopped)
            rearm(timeoutMillis);
    }

    synchronized void stop() {
        stopped = true;
        if(timeoutFuture != null)
            timeoutFuture.cancel(false);
    }

    private void rearm(long timeoutMillis) {
        if(timeoutFuture != null)
            timeoutFuture.cancel(false);
        timeoutFuture = Worker.schedule(this::fire, timeoutMillis);
    }

    private void fire() {
        synchronized (this) {
            if(stopped)
                return;
        }
        // Teardown runs listeners, keep it off the scheduler thread.
        Worker.execute(onTimeout);
    }
}
