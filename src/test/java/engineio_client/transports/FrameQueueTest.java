package engineio_client.transports;

import org.junit.Test;

import java.io.EOFException;
import java.io.IOException;

import static org.junit.Assert.*;

public class FrameQueueTest {

    @Test
    public void testFramesBeforeFailureAreDelivered() throws IOException {
        FrameQueue queue = new FrameQueue();
        queue.offer(Frame.text("4hello"));
        queue.offer(Frame.binary(new byte[]{1}));
        EOFException failure = new EOFException("closed");
        assertTrue(queue.fail(failure));

        assertEquals(Frame.text("4hello"), queue.take());
        assertEquals(Frame.binary(new byte[]{1}), queue.take());
        IOException thrown = assertThrows(IOException.class, queue::take);
        assertSame(failure, thrown);
        // Every later read fails the same way.
        assertSame(failure, assertThrows(IOException.class, queue::take));
    }

    @Test
    public void testOnlyFirstFailureIsKept() {
        FrameQueue queue = new FrameQueue();
        IOException first = new IOException("first");

        assertTrue(queue.fail(first));
        assertFalse(queue.fail(new IOException("second")));
        assertTrue(queue.isFailed());
        assertSame(first, assertThrows(IOException.class, queue::take));
    }

    @Test
    public void testOfferAfterFailureIsIgnored() {
        FrameQueue queue = new FrameQueue();
        IOException failure = new IOException("failed");
        queue.fail(failure);
        queue.offer(Frame.text("4late"));

        assertSame(failure, assertThrows(IOException.class, queue::take));
    }
}
