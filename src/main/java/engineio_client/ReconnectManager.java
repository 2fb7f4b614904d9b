package engineio_client;

/**
 * Exponential backoff for reconnect attempts.
 * The first delay is the base delay, every following one is twice the previous, up to the max delay.
 * {@link #reset()} starts the sequence over, which happens on every successful dial.
 *
 * <p> Not thread safe, {@link EngineSocket} guards it with its lock.
 */
class ReconnectManager {

    private final long reconnectDelay;
    private final long maxReconnectDelay;
    private long nextDelay;
    int reconnectsAttempted;

    ReconnectManager(long reconnectDelay, long maxReconnectDelay) {
        this.reconnectDelay = reconnectDelay < 1 ? 1 : reconnectDelay;
        this.maxReconnectDelay = maxReconnectDelay < this.reconnectDelay ? this.reconnectDelay : maxReconnectDelay;
        reset();
    }

    void reset() {
        nextDelay = reconnectDelay;
        reconnectsAttempted = 0;
    }

    long calculateDelay() {
        long delay = nextDelay;
        ++reconnectsAttempted;
        nextDelay = delay >= maxReconnectDelay / 2 ? maxReconnectDelay : delay * 2;
        return delay;
    }
}
