package engineio_client.transports;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Opens framed duplex connections to an engine.io server.
 * {@link WebSocketTransport} is the implementation used by default.
 */
public interface Transport {

    /**
     * Open a connection. Blocks until the connection is established, fails, or the timeout elapses.
     *
     * @param url Connection URL, see {@link common.Utils#buildConnectionUrl(engineio_client.Config)}.
     * @param headers Extra headers for the opening request, may be empty.
     * @param timeoutMillis Upper bound for the dial in milliseconds, 0 for no bound other than the underlying client's.
     * @return The open connection.
     * @throws IOException if the connection can't be established.
     */
    Connection dial(String url, Map<String, String> headers, long timeoutMillis) throws IOException;

    /**
     * A connection made by a {@link Transport}. Frames are read by a single consumer,
     *  while writes and close may come from any thread.
     */
    interface Connection extends Closeable {

        /**
         * Block until the next frame arrives.
         * Frames received before the connection ended are all returned before the failure is reported.
         *
         * @return The next frame.
         * @throws IOException once the connection ended, for any reason, including {@link #close()}.
         */
        Frame nextFrame() throws IOException;

        /**
         * Write a frame.
         *
         * @throws IOException if the connection can't accept the frame anymore.
         */
        void write(Frame frame) throws IOException;

        /**
         * Close the connection. Idempotent, never throws, and unblocks a pending {@link #nextFrame()}.
         */
        @Override
        void close();
    }
}
