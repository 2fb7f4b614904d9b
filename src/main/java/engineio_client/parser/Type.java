package engineio_client.parser;

import exceptions.EngineIOParserException;

/**
 * Engine.IO packet types, along with the character that identifies each of them on the wire.
 * {@link #BINARY} is not a numbered protocol type, it marks a base64 encoded binary body in a text frame ('b' prefix).
 */
public enum Type {

    OPEN('0'), CLOSE('1'), PING('2'), PONG('3'), MESSAGE('4'), UPGRADE('5'), NOOP('6'), BINARY('b');

    final char value;

    Type(char value) {
        this.value = value;
    }

    static Type of(char val) {
        switch (val) {
            case '0': return OPEN;
            case '1': return CLOSE;
            case '2': return PING;
            case '3': return PONG;
            case '4': return MESSAGE;
            case '5': return UPGRADE;
            case '6': return NOOP;
            case 'b': return BINARY;
            default:
                throw new EngineIOParserException("Invalid engine.io packet type (" + val + ").");
        }
    }

    // Returns type's value as the single byte that starts a text encoded packet.
    byte toByteValue() {
        return (byte) value;
    }
}
