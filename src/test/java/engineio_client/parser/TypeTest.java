package engineio_client.parser;

import exceptions.EngineIOParserException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TypeTest {

    @Test
    public void testOf() {
        assertEquals(Type.of('0'), Type.OPEN);
        assertEquals(Type.of('1'), Type.CLOSE);
        assertEquals(Type.of('2'), Type.PING);
        assertEquals(Type.of('3'), Type.PONG);
        assertEquals(Type.of('4'), Type.MESSAGE);
        assertEquals(Type.of('5'), Type.UPGRADE);
        assertEquals(Type.of('6'), Type.NOOP);
        assertEquals(Type.of('b'), Type.BINARY);

        assertThrows(EngineIOParserException.class, () -> Type.of('7'));
        assertThrows(EngineIOParserException.class, () -> Type.of('9'));
        assertThrows(EngineIOParserException.class, () -> Type.of('x'));
    }

    @Test
    public void toByteValue() {
        assertEquals(0x30, Type.OPEN.toByteValue());
        assertEquals(0x31, Type.CLOSE.toByteValue());
        assertEquals(0x32, Type.PING.toByteValue());
        assertEquals(0x33, Type.PONG.toByteValue());
        assertEquals(0x34, Type.MESSAGE.toByteValue());
        assertEquals(0x35, Type.UPGRADE.toByteValue());
        assertEquals(0x36, Type.NOOP.toByteValue());
        assertEquals(0x62, Type.BINARY.toByteValue());
    }
}
