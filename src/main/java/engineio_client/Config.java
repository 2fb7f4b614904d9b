package engineio_client;

import okhttp3.OkHttpClient;
import okhttp3.WebSocket;

import java.util.HashMap;
import java.util.Map;

/**
 * Configures the Engine.IO client.
 * Available configurations are:
 * <p> {@code boolean secure} Whether to connect with {@code wss} or {@code ws}. (true by default)
 * <p> {@code String host} Host and port to connect to, like {@code "localhost:3000"}.
 *      <br>A scheme prefix ({@code ws://}, {@code http://}, {@code wss://}, {@code https://}) overrides {@code secure}.
 * <p> {@code String path} Path that the connection should be made. ("/engine.io/" by default)
 * <p> {@code Map<String, String> queryMap} Extra query parameters for the connection.
 *      <br>EIO (protocol version) and transport are always added, see {@link common.Utils#buildConnectionUrl(Config)}.
 * <p> {@code Map<String, String> headerMap} Extra headers for the connection.
 * <p> {@code long dialTimeout} Upper bound for a single dial, in milliseconds. (0, meaning no bound, by default)
 * <p> {@code boolean reconnect} Whether to reconnect after the connection is lost unexpectedly. (true by default)
 * <p> {@code long reconnectDelay} Delay before the first reconnect attempt, doubled on each consecutive attempt. (1,000 ms by default)
 * <p> {@code long maxReconnectDelay} An upper bound for reconnect delay. (300,000 ms by default)
 * <p> {@code long closeTimeout} How long {@link EngineSocket#close()} waits for the server to close the connection
 *      before closing it locally. (5,000 ms by default)
 * <p> {@code WebSocket.Factory webSocketFactory} OkHttp WebSocket.Factory used by the default transport.
 *
 * <p> An {@link EngineSocket} works on its own copy, so changing a Config after the socket is created has no effect on it.
 */
public class Config implements Cloneable {

    public boolean secure;
    public String host;
    public String path;
    public Map<String, String> queryMap;
    public Map<String, String> headerMap;
    public long dialTimeout;
    public boolean reconnect;
    public long reconnectDelay;
    public long maxReconnectDelay;
    public long closeTimeout;
    public WebSocket.Factory webSocketFactory;

    public Config() {
        secure = true;
        path = "/engine.io/";
        queryMap = new HashMap<>();
        headerMap = new HashMap<>();
        reconnect = true;
        reconnectDelay = 1000;
        maxReconnectDelay = 5 * 60 * 1000;
        closeTimeout = 5000;
        webSocketFactory = new OkHttpClient();
    }

    @Override
    public Config clone() {
        try {
            Config copyConfig = (Config) super.clone();
            copyConfig.queryMap = queryMap == null ? new HashMap<>() : new HashMap<>(queryMap);
            copyConfig.headerMap = headerMap == null ? new HashMap<>() : new HashMap<>(headerMap);
            // OkHttpClient is immutable and meant to be shared.
            copyConfig.webSocketFactory = webSocketFactory;
            return copyConfig;
        } catch (CloneNotSupportedException e) {
            throw new AssertionError("Config is Cloneable", e);
        }
    }
}
