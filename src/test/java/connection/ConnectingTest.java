package connection;

import engineio_client.Config;
import engineio_client.EngineSocket;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.fail;

/**
 * Base class for tests that connect an {@link EngineSocket} to a {@link MockTransport}.
 */
public abstract class ConnectingTest {

    protected final String host = "localhost:3000";
    protected final int timeoutMs = 5000;

    protected MockTransport transport;

    public static String handshakeJson(String sid, long pingInterval, long pingTimeout) {
        return new JSONObject()
                .put("sid", sid)
                .put("upgrades", new JSONArray())
                .put("pingInterval", pingInterval)
                .put("pingTimeout", pingTimeout)
                .put("maxPayload", 1000000)
                .toString();
    }

    protected Config config() {
        Config config = new Config();
        config.host = host;
        config.secure = false;
        config.reconnectDelay = 50;
        config.maxReconnectDelay = 200;
        config.closeTimeout = 500;
        return config;
    }

    protected EngineSocket newSocket(Config config) {
        transport = new MockTransport();
        return new EngineSocket(config, transport);
    }

    protected EngineSocket newSocket() {
        return newSocket(config());
    }

    protected void await(String testName, CountDownLatch latch) {
        try {
            boolean latchZeroed = latch.await(timeoutMs, TimeUnit.MILLISECONDS);
            if (!latchZeroed)
                fail("Test '" + testName + "' timed out.");
        } catch (InterruptedException e) {
            fail("Test " + testName + " interrupted.");
        }
    }
}
