package exceptions;

/**
 * Raised when a received frame can't be decoded into an engine.io packet.
 */
public class EngineIOParserException extends EngineIOException {

    public EngineIOParserException(String message) {
        super(message);
    }

    public EngineIOParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
