package engineio_client.transports;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single message of a framed duplex connection, either text (UTF-8 bytes) or binary.
 */
public final class Frame {

    private enum Kind {
        TEXT, BINARY
    }

    private final Kind kind;
    private final byte[] data;

    private Frame(Kind kind, byte[] data) {
        this.kind = kind;
        this.data = data == null ? new byte[0] : data;
    }

    public static Frame text(String text) {
        return new Frame(Kind.TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public static Frame text(byte[] utf8) {
        return new Frame(Kind.TEXT, utf8);
    }

    public static Frame binary(byte[] data) {
        return new Frame(Kind.BINARY, data);
    }

    public boolean isBinary() {
        return kind == Kind.BINARY;
    }

    public byte[] getData() {
        return data;
    }

    public String getText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof Frame))
            return false;
        Frame frame = (Frame) obj;
        return kind == frame.kind && Arrays.equals(data, frame.data);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Frame{" + kind + ", " + (isBinary() ? Arrays.toString(data) : getText()) + '}';
    }
}
