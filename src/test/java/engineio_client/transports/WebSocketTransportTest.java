package engineio_client.transports;

import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okio.ByteString;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Collections;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class WebSocketTransportTest {

    private final int timeoutMs = 5000;
    private final BlockingQueue<Object> serverReceived = new LinkedBlockingQueue<>();
    private final BlockingQueue<WebSocket> serverSockets = new LinkedBlockingQueue<>();
    private MockWebServer server;
    private WebSocketTransport transport;

    @Before
    public void beforeEach() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new WebSocketTransport(new OkHttpClient());
    }

    @After
    public void afterEach() throws IOException {
        server.shutdown();
    }

    private String url() {
        return "ws://" + server.getHostName() + ":" + server.getPort() + "/engine.io/?EIO=4&transport=websocket";
    }

    private void enqueueUpgrade() {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                serverSockets.offer(webSocket);
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                serverReceived.offer(text);
            }

            @Override
            public void onMessage(WebSocket webSocket, ByteString bytes) {
                serverReceived.offer(bytes);
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(1000, null);
            }
        }));
    }

    @Test
    public void testDialWithHeaders() throws Exception {
        enqueueUpgrade();
        Transport.Connection connection = transport.dial(url(), Collections.singletonMap("Authorization", "Bearer token"), timeoutMs);

        RecordedRequest request = server.takeRequest(timeoutMs, TimeUnit.MILLISECONDS);
        assertEquals("/engine.io/?EIO=4&transport=websocket", request.getPath());
        assertEquals("Bearer token", request.getHeader("Authorization"));
        connection.close();
    }

    @Test
    public void testReadAndWriteFrames() throws Exception {
        enqueueUpgrade();
        Transport.Connection connection = transport.dial(url(), null, timeoutMs);
        WebSocket serverSocket = serverSockets.poll(timeoutMs, TimeUnit.MILLISECONDS);
        assertNotNull(serverSocket);

        serverSocket.send("4hello");
        serverSocket.send(ByteString.of((byte) 1, (byte) 2));
        assertEquals(Frame.text("4hello"), connection.nextFrame());
        assertEquals(Frame.binary(new byte[]{1, 2}), connection.nextFrame());

        connection.write(Frame.text("4world"));
        connection.write(Frame.binary(new byte[]{3, 4}));
        assertEquals("4world", serverReceived.poll(timeoutMs, TimeUnit.MILLISECONDS));
        assertEquals(ByteString.of((byte) 3, (byte) 4), serverReceived.poll(timeoutMs, TimeUnit.MILLISECONDS));
        connection.close();
    }

    @Test
    public void testServerCloseEndsStream() throws Exception {
        enqueueUpgrade();
        Transport.Connection connection = transport.dial(url(), null, timeoutMs);
        WebSocket serverSocket = serverSockets.poll(timeoutMs, TimeUnit.MILLISECONDS);

        serverSocket.send("4last");
        serverSocket.close(1000, "bye");

        assertEquals(Frame.text("4last"), connection.nextFrame());
        assertThrows(IOException.class, connection::nextFrame);
    }

    @Test
    public void testCloseEndsStream() throws Exception {
        enqueueUpgrade();
        Transport.Connection connection = transport.dial(url(), null, timeoutMs);

        connection.close();
        connection.close();
        assertThrows(IOException.class, connection::nextFrame);
        assertThrows(IOException.class, () -> connection.write(Frame.text("4late")));
    }

    @Test
    public void testDialFailsWithoutUpgrade() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThrows(IOException.class, () -> transport.dial(url(), null, timeoutMs));
    }

    @Test
    public void testDialTimeout() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        assertThrows(SocketTimeoutException.class, () -> transport.dial(url(), null, 200));
    }
}
