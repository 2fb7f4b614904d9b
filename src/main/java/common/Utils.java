package common;

import engineio_client.Config;
import engineio_client.parser.Parser;
import engineio_client.transports.WebSocketTransport;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.joining;

/**
 * Static utility methods that are used through out the entire API.
 */
public class Utils {

    /**
     * Given a {@code Map<String, String>} builds a query string from its entries.
     *
     * @param queryMap The {@code Map<String, String>} instance that contains key->value pairs.
     * @return The query string that will be appended to the connection URL.
     */
    public static String getQueryStringFromMap(Map<String, String> queryMap) {
       if(queryMap == null)
           return "";

       return queryMap.entrySet()
                        .stream()
                        .map(entry -> encodeQueryString(entry.getKey()) + "=" + encodeQueryString(entry.getValue()))
                        .collect(joining("&"));
    }

    static String encodeQueryString(String str) {
       if(str == null)
           return "";
       try {
           return URLEncoder.encode(str, StandardCharsets.UTF_8.name())
                   .replace("+", "%20")
                   .replace("%21", "!")
                   .replace("%27", "'")
                   .replace("%28", "(")
                   .replace("%29", ")")
                   .replace("%7E", "~");
       } catch (UnsupportedEncodingException e) {
           return str;
       }
    }

    /**
     * Builds the WebSocket URL an engine.io connection is dialed to.
     * <p> The scheme is {@code wss} for secure connections and {@code ws} otherwise.
     *      A scheme prefix on {@link Config#host} ({@code ws://}, {@code http://}, {@code wss://}, {@code https://}) overrides {@link Config#secure}.
     * <p> Query keys are sorted, and the query always contains the protocol version (EIO) and the transport name.
     *
     * @param config Configuration to build the URL from.
     * @return The connection URL.
     */
    public static String buildConnectionUrl(Config config) {
        String host = config.host == null ? "" : config.host;
        boolean secure = config.secure;
        int schemeEnd = host.indexOf("://");
        if(schemeEnd > 0) {
            String scheme = host.substring(0, schemeEnd);
            host = host.substring(schemeEnd + "://".length());
            secure = !("ws".equals(scheme) || "http".equals(scheme));
        }

        String path = config.path == null || config.path.isEmpty() ? "/" : config.path;
        if(!path.startsWith("/"))
            path = "/" + path;

        Map<String, String> query = new TreeMap<>();
        if(config.queryMap != null)
            query.putAll(config.queryMap);
        query.put("EIO", Parser.VERSION);
        query.put("transport", WebSocketTransport.NAME);

        return (secure ? "wss" : "ws") + "://" + host + path + "?" + getQueryStringFromMap(query);
    }
}
