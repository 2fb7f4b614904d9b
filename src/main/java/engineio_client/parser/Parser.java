package engineio_client.parser;

import exceptions.EngineIOParserException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Parser implementation for engine.io packets sent over a WebSocket, one packet per frame.
 *
 * <p> Text frames carry: TypeValue + data.
 * <p> For example: Packet of type MESSAGE(4) with data "Hello" would be encoded as -> 4Hello.
 * <br> A text frame that starts with 'b' carries a base64 encoded binary body, for example -> bAQID is BINARY [1,2,3].
 * <p> Binary packets are never text encoded by this client. They are written as binary frames holding only the body,
 *      and binary frames received from the server are delivered as they are, without going through this parser.
 *
 * @see <a href="https://github.com/socketio/engine.io-protocol">EngineIO protocol</a> for detailed information.
 */
public class Parser {

    //Engine.IO protocol version.
    public static final String VERSION = "4";

    /**
     * Encode a packet into the payload of a text frame.
     * For a {@link Type#BINARY} packet, the body itself is returned since it is sent as a binary frame.
     *
     * @param packet Packet to encode.
     * @return The encoded bytes.
     */
    public byte[] encodePacket(Packet packet) {
        if(packet.isBinary())
            return packet.body;

        byte[] data = new byte[packet.body.length + 1];
        data[0] = packet.type.toByteValue();
        System.arraycopy(packet.body, 0, data, 1, packet.body.length);
        return data;
    }

    public Packet decodePacket(String encodedPacketData) {
        if(encodedPacketData == null)
            throw new EngineIOParserException("Can't decode a null packet.");
        return decodePacket(encodedPacketData.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decode the payload of a text frame.
     *
     * @param encodedPacketData UTF-8 bytes of the frame.
     * @return The decoded packet.
     * @throws EngineIOParserException if the data is empty, starts with an unknown type or carries invalid base64.
     */
    public Packet decodePacket(byte[] encodedPacketData) {
        if(encodedPacketData == null || encodedPacketData.length == 0)
            throw new EngineIOParserException("Received an empty packet.");

        Type type = Type.of((char) (encodedPacketData[0] & 0xFF));
        byte[] body = Arrays.copyOfRange(encodedPacketData, 1, encodedPacketData.length);
        if(type == Type.BINARY) {
            try {
                body = Base64.getDecoder().decode(body);
            } catch (IllegalArgumentException e) {
                throw new EngineIOParserException("Invalid base64 body in binary packet.", e);
            }
        }
        return new Packet(type, body);
    }
}
