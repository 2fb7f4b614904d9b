package engineio_client;

/**
 * Passed to dial error listeners, see {@link EngineSocket#onDialError(common.Observable.Callback)}.
 * <p> {@code count} is -1 for an explicit {@link EngineSocket#dial()} and the number of consecutive failed attempts
 *      for automatic reconnects.
 * <p> A listener can call {@link #cancelReDial()} to stop reconnecting after this failure.
 */
public class DialErrorContext {

    private final int count;
    private final Throwable error;
    private volatile boolean reDialCancelled;

    DialErrorContext(int count, Throwable error) {
        this.count = count;
        this.error = error;
    }

    public int getCount() {
        return count;
    }

    public Throwable getError() {
        return error;
    }

    public boolean isReDialCancelled() {
        return reDialCancelled;
    }

    public void cancelReDial() {
        reDialCancelled = true;
    }

    @Override
    public String toString() {
        return "DialErrorContext{" +
                "count=" + count +
                ", error=" + error +
                ", reDialCancelled=" + reDialCancelled +
                '}';
    }
}
