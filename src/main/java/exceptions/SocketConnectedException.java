package exceptions;

/**
 * Thrown by {@code dial} when the socket is not closed, that is, a connection is already open or being opened.
 */
public class SocketConnectedException extends EngineIOException {

    public SocketConnectedException() {
        super("Engine.IO: socket was already connected");
    }
}
