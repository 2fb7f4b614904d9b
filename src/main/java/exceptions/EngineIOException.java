package exceptions;

/**
 * Root of the exceptions raised by the Engine.IO client.
 * Also used on its own for protocol violations and for a failed explicit dial, in which case the cause is the transport's error.
 */
public class EngineIOException extends RuntimeException {

    public EngineIOException(String message) {
        super(message);
    }

    public EngineIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
