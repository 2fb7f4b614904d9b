package exceptions;

/**
 * Cause of a disconnect when no frame arrived from the server within pingInterval + pingTimeout milliseconds.
 */
public class PingTimeoutException extends EngineIOException {

    public PingTimeoutException() {
        super("Engine.IO: did not receive PING packet for a long time");
    }
}
