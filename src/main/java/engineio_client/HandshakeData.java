package engineio_client;

import exceptions.EngineIOException;
import org.json.JSONArray;
import org.json.JSONObject;
import java.util.Arrays;

/**
 * Represents the handshake options given by the server in the OPEN packet. Options are comprised of:
 * <p> String sessionId, id given to this engine.io client by the server.
 * <p> String[] upgrades, which transports the server could upgrade to. Not used by this client, since it only speaks WebSocket.
 * <p> int pingInterval, at which intervals (milliseconds) the server sends a PING packet.
 * <p> int pingTimeout, how long (milliseconds) after a missed PING the server is considered gone.
 * <p> int maxPayload, the maximum number of bytes per packet the server accepts.
 */
public class HandshakeData {

    private final String sessionId;
    private final String[] upgrades;
    private final int pingInterval;
    private final int pingTimeout;
    private final int maxPayload;

    private HandshakeData(String sessionId, String[] upgrades, int pingInterval, int pingTimeout, int maxPayload) {
        this.sessionId = sessionId;
        this.upgrades = upgrades;
        this.pingInterval = pingInterval;
        this.pingTimeout = pingTimeout;
        this.maxPayload = maxPayload;
    }

    /**
     * @param data JSON body of an OPEN packet.
     * @return Parsed handshake.
     * @throws EngineIOException if the data isn't JSON or sid, pingInterval or pingTimeout is missing.
     */
    public static HandshakeData parseHandshake(String data) {
        try {
            JSONObject json = new JSONObject(data);

            String sid = json.getString("sid");
            int pingInterval = json.getInt("pingInterval");
            int pingTimeout = json.getInt("pingTimeout");
            int maxPayload = json.optInt("maxPayload", 0);

            JSONArray upgradesArray = json.optJSONArray("upgrades");
            String[] upgrades = new String[upgradesArray == null ? 0 : upgradesArray.length()];
            for(int i = 0; i < upgrades.length; i++)
                upgrades[i] = upgradesArray.getString(i);

            return new HandshakeData(sid, upgrades, pingInterval, pingTimeout, maxPayload);
        } catch(Exception e) {
            throw new EngineIOException("Error while parsing handshake data=" + data, e);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String[] getUpgrades() {
        return upgrades;
    }

    public int getPingInterval() {
        return pingInterval;
    }

    public int getPingTimeout() {
        return pingTimeout;
    }

    public int getMaxPayload() {
        return maxPayload;
    }

    @Override
    public String toString() {
        return "HandshakeData{" +
                "sessionId='" + sessionId + '\'' +
                ", upgrades=" + Arrays.toString(upgrades) +
                ", pingInterval=" + pingInterval +
                ", pingTimeout=" + pingTimeout +
                ", maxPayload=" + maxPayload +
                '}';
    }
}
