package engineio_client.parser;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Represents an Engine.IO packet: a {@link Type} and an opaque body.
 * <p> The body of an OPEN packet is the JSON handshake, MESSAGE and BINARY bodies are application data,
 *  PING and PONG bodies are echoed back as is.
 * <p>
 * @see <a href="https://github.com/socketio/engine.io-protocol">Engine.IO Protocol</a> for detailed information.
 */
public class Packet {

    private static final byte[] EMPTY_BYTE_ARRAY = new byte[]{};
    public static final Packet CLOSE = new Packet(Type.CLOSE);

    final Type type;
    final byte[] body;

    public Packet(Type type) {
        this(type, (byte[]) null);
    }

    public Packet(Type type, byte[] body) {
        if(type == null)
            throw new NullPointerException("type");
        this.type = type;
        this.body = body == null ? EMPTY_BYTE_ARRAY : body;
    }

    public Packet(Type type, String body) {
        this(type, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public Type getType() {
        return type;
    }

    /**
     * @return The body, never null. Zero length when the packet has none.
     */
    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isBinary() {
        return type == Type.BINARY;
    }

    @Override
    public String toString() {
        return "Packet{" +
                "type=" + type +
                ", body=" + (isBinary() ? Arrays.toString(body) : getBodyAsString()) +
                '}';
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;

        if(!(obj instanceof Packet))
            return false;

        Packet packet = (Packet) obj;
        return type == packet.type && Arrays.equals(body, packet.body);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(body);
    }
}
