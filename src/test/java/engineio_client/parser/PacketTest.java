package engineio_client.parser;

import org.junit.Test;

import static org.junit.Assert.*;

public class PacketTest {

    @Test
    public void testPacketType() {
        assertTrue(new Packet(Type.BINARY, new byte[1]).isBinary());
        assertFalse(new Packet(Type.MESSAGE, new byte[1]).isBinary());
        assertFalse(new Packet(Type.MESSAGE, "").isBinary());
    }

    @Test
    public void testPacketBody() {
        assertArrayEquals(new Packet(Type.MESSAGE).getBody(), new byte[0]);
        assertArrayEquals(new Packet(Type.MESSAGE, (String) null).getBody(), new byte[0]);
        assertArrayEquals(new Packet(Type.MESSAGE, (byte[]) null).getBody(), new byte[0]);
        assertArrayEquals(new Packet(Type.MESSAGE, new byte[]{1,2,3}).getBody(), new byte[]{1,2,3});
        assertArrayEquals(new Packet(Type.MESSAGE, "abc").getBody(), new byte[]{0x61, 0x62, 0x63});
        assertArrayEquals(new Packet(Type.MESSAGE, "abcçöü").getBody(),
                new byte[]{0x61, 0x62, 0x63, (byte)0xc3, (byte)0xa7, (byte)0xc3, (byte)0xb6, (byte)0xc3, (byte)0xbc});
        assertEquals("abcçöü", new Packet(Type.MESSAGE, "abcçöü").getBodyAsString());
    }

    @Test
    public void testEquality() {
        assertEquals(new Packet(Type.MESSAGE, "abc"), new Packet(Type.MESSAGE, new byte[]{0x61, 0x62, 0x63}));
        assertEquals(new Packet(Type.MESSAGE, "abc").hashCode(), new Packet(Type.MESSAGE, new byte[]{0x61, 0x62, 0x63}).hashCode());
        assertNotEquals(new Packet(Type.MESSAGE, "abc"), new Packet(Type.PING, "abc"));
        assertEquals(Packet.CLOSE, new Packet(Type.CLOSE));
    }

    @Test
    public void testClosePacket() {
        assertEquals(Type.CLOSE, Packet.CLOSE.getType());
        assertNotNull(Packet.CLOSE.getBody());
        assertEquals(0, Packet.CLOSE.getBody().length);
        assertArrayEquals("1".getBytes(), new Parser().encodePacket(Packet.CLOSE));
    }

    @Test
    public void testNullType() {
        assertThrows(NullPointerException.class, () -> new Packet(null));
    }
}
