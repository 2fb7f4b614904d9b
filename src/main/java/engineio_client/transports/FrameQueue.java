package engineio_client.transports;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands frames pushed by a transport's callback thread over to the single reader of a {@link Transport.Connection}.
 * Once failed, the queue keeps delivering the frames that were already queued, then reports the failure on every read.
 */
public class FrameQueue {

    // Marks the end of the stream, compared by identity.
    private static final Frame END = Frame.binary(new byte[0]);

    private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
    private final AtomicReference<IOException> failure = new AtomicReference<>();

    /**
     * Queue a received frame. Ignored once the queue failed.
     */
    public void offer(Frame frame) {
        if(failure.get() == null)
            frames.offer(frame);
    }

    /**
     * End the stream. Only the first failure is kept.
     *
     * @return true if this call ended the stream.
     */
    public boolean fail(IOException e) {
        if(!failure.compareAndSet(null, e))
            return false;
        frames.offer(END);
        return true;
    }

    public boolean isFailed() {
        return failure.get() != null;
    }

    /**
     * Block until a frame is available.
     *
     * @throws IOException the failure the stream ended with, or {@link InterruptedIOException} if the reader is interrupted.
     */
    public Frame take() throws IOException {
        Frame frame;
        try {
            frame = frames.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for the next frame.");
        }
        if(frame == END) {
            // Put it back so that any later read fails the same way.
            frames.offer(END);
            throw failure.get();
        }
        return frame;
    }
}
