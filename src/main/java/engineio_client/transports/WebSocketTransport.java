package engineio_client.transports;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link Transport} backed by OkHttp WebSockets.
 * OkHttp pushes received messages on its own thread; they are queued and handed to the reader of the connection
 *  through {@link Transport.Connection#nextFrame()}.
 */
public class WebSocketTransport implements Transport {

    private final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);

    public static final String NAME = "websocket";
    private static final int NORMAL_CLOSURE_STATUS = 1000;

    private final WebSocket.Factory webSocketFactory;

    public WebSocketTransport() {
        this(new OkHttpClient());
    }

    public WebSocketTransport(WebSocket.Factory webSocketFactory) {
        this.webSocketFactory = webSocketFactory;
    }

    @Override
    public Connection dial(String url, Map<String, String> headers, long timeoutMillis) throws IOException {
        Request.Builder requestBuilder = new Request.Builder()
                                                    .url(url);
        if(headers != null)
            headers.forEach(requestBuilder::addHeader);

        WebSocketConnection connection = new WebSocketConnection(url);
        WebSocket webSocket = webSocketFactory.newWebSocket(requestBuilder.build(), connection);
        connection.awaitOpen(webSocket, timeoutMillis);
        logger.debug("WebSocket connection to {} is open.", url);
        return connection;
    }

    private class WebSocketConnection extends WebSocketListener implements Connection {

        private final String url;
        private final CompletableFuture<Void> opened = new CompletableFuture<>();
        private final FrameQueue frames = new FrameQueue();
        private volatile WebSocket webSocket;

        private WebSocketConnection(String url) {
            this.url = url;
        }

        private void awaitOpen(WebSocket webSocket, long timeoutMillis) throws IOException {
            this.webSocket = webSocket;
            try {
                if(timeoutMillis > 0)
                    opened.get(timeoutMillis, TimeUnit.MILLISECONDS);
                else
                    opened.get();
            } catch (TimeoutException e) {
                webSocket.cancel();
                throw new SocketTimeoutException("WebSocket dial to " + url + " timed out after " + timeoutMillis + " ms.");
            } catch (InterruptedException e) {
                webSocket.cancel();
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while dialing " + url);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if(cause instanceof IOException)
                    throw (IOException) cause;
                throw new IOException("WebSocket dial to " + url + " failed.", cause);
            }
        }

        @Override
        public Frame nextFrame() throws IOException {
            return frames.take();
        }

        @Override
        public void write(Frame frame) throws IOException {
            boolean enqueued = frame.isBinary() ? webSocket.send(ByteString.of(frame.getData()))
                                                : webSocket.send(frame.getText());
            if(!enqueued)
                throw new IOException("WebSocket is closing or closed, frame was not written.");
        }

        @Override
        public void close() {
            if(frames.fail(new EOFException("WebSocket connection closed by client.")))
                webSocket.close(NORMAL_CLOSURE_STATUS, null);
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.complete(null);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            frames.offer(Frame.text(text));
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            frames.offer(Frame.binary(bytes.toByteArray()));
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE_STATUS, null);
            frames.fail(new EOFException("WebSocket closed by server, code=" + code + ", reason=" + reason));
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            frames.fail(new EOFException("WebSocket closed, code=" + code + ", reason=" + reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            IOException e = t instanceof IOException ? (IOException) t : new IOException("WebSocket failure.", t);
            if(opened.completeExceptionally(e)) {
                logger.error("WebSocket dial to {} failed. Response: {}", url, response, t);
                return;
            }
            if(frames.fail(e))
                logger.error("WebSocket connection to {} failed.", url, t);
        }
    }
}
