package engineio_client;

import common.CancelSignal;
import common.Observable;
import common.Observable.Callback;
import common.Observable.CallbackHandle;
import common.Utils;
import common.Worker;
import engineio_client.parser.Packet;
import engineio_client.parser.Parser;
import engineio_client.parser.Type;
import engineio_client.transports.Frame;
import engineio_client.transports.Transport;
import engineio_client.transports.WebSocketTransport;
import exceptions.EngineIOException;
import exceptions.EngineIOParserException;
import exceptions.PingTimeoutException;
import exceptions.SocketConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an engine.io connection over WebSocket, that survives the loss of the underlying connection.
 *
 * <p> {@link #dial()} opens a {@link Transport} connection and starts a reader for it on a {@link Worker} thread.
 *      The connection is considered connected when the reader receives the OPEN packet with the handshake data.
 *      From then on, any frame has to arrive within pingInterval + pingTimeout milliseconds,
 *      otherwise the connection is closed with a {@link PingTimeoutException}.
 * <p> When the connection ends with an error (transport failure, protocol violation, ping timeout),
 *      it is dialed again after an exponentially growing delay, until a dial succeeds or {@link #close()} is called.
 *      A CLOSE packet from the server ends the connection without reconnecting.
 * <p> Messages emitted while not connected are buffered and written, in order, right after the next handshake.
 *
 * <p> EngineSocket instances emit some events for the clients to register for. Each has an {@code on} (every time)
 *      and a {@code once} (next time only) registration method:
 * <p> connect, after the handshake is processed, with the socket itself.
 * <p> disconnect, when a connection ends, with the cause, or null if it ended orderly.
 * <p> dial error, when a dial fails, with a {@link DialErrorContext}.
 * <p> reconnect, when an automatic reconnect dial succeeds, before its handshake, with the socket itself.
 * <p> pong, message and binary, with the body of the received PONG, MESSAGE and BINARY packets.
 *      Binary frames are delivered as binary events as they are.
 * <p> receive and send, with the raw bytes of every received text frame and every written packet.
 *
 * <p> Callbacks run on the reader thread, on a {@link Worker} executor thread (ping timeout, forced close, reconnects)
 *      or on the thread calling {@link #dial()}/{@link #emit(byte[])}. No lock is held while they run, so they can call any method of the socket.
 * <p> An exception thrown by a disconnect, dial error or reconnect listener is logged and doesn't stop reconnecting.
 *      One thrown by any other listener on the reader thread closes the connection with that exception.
 */
public class EngineSocket {

    private final Logger logger = LoggerFactory.getLogger(EngineSocket.class);

    private final Config config;
    private final String url;
    private final Transport transport;
    private final Parser parser;

    /**
     * Guards the session data, the current attempt, the dial signal, the reconnect counters and the send buffer.
     * Held only to read or mutate them, frames are written under it only when the send buffer is flushed.
     */
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    /**
     * Changed without the lock only from CLOSED to OPENING (dial) and from OPENING to CLOSED (failed dial).
     * Every transition from or to CONNECTED happens under the write lock.
     */
    private final AtomicReference<Status> status = new AtomicReference<>(Status.CLOSED);
    private final AtomicBoolean closeRequested = new AtomicBoolean();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<ReconnectTask> reconnectTask = new AtomicReference<>();

    private String sessionId = "";
    /**
     * Interval of the server's PING packets, from the last handshake.
     */
    private long pingInterval;
    /**
     * How long to wait, on top of pingInterval, before considering the server gone.
     */
    private long pingTimeout;
    private int maxPayload;
    private Attempt attempt;
    private CancelSignal dialSignal;
    private int reDialCount;
    private final ReconnectManager reconnectManager;
    private final List<Packet> sendBuffer = new ArrayList<>();

    private final Observable<EngineSocket> connectHandlers = new Observable<>();
    private final Observable<Throwable> disconnectHandlers = new Observable<>();
    private final Observable<DialErrorContext> dialErrorHandlers = new Observable<>();
    private final Observable<EngineSocket> reconnectHandlers = new Observable<>();
    private final Observable<byte[]> pongHandlers = new Observable<>();
    private final Observable<byte[]> binaryHandlers = new Observable<>();
    private final Observable<byte[]> messageHandlers = new Observable<>();
    private final Observable<byte[]> receiveHandlers = new Observable<>();
    private final Observable<byte[]> sendHandlers = new Observable<>();

    public EngineSocket(String host) {
        this(hostConfig(host));
    }

    public EngineSocket(Config config) {
        this(config, null);
    }

    /**
     * @param config Configuration, copied. Defaults are used when null.
     * @param transport Transport to dial with, a {@link WebSocketTransport} on {@link Config#webSocketFactory} when null.
     */
    public EngineSocket(Config config, Transport transport) {
        this.config = config == null ? new Config() : config.clone();
        this.url = Utils.buildConnectionUrl(this.config);
        this.transport = transport != null ? transport : new WebSocketTransport(this.config.webSocketFactory);
        this.parser = new Parser();
        this.reconnectManager = new ReconnectManager(this.config.reconnectDelay, this.config.maxReconnectDelay);
    }

    private static Config hostConfig(String host) {
        Config config = new Config();
        config.host = host;
        return config;
    }

    /**
     * Open the connection, with a reconnect lineage that ends only with {@link #close()}.
     *
     * @see #dial(CancelSignal)
     */
    public void dial() {
        dial(new CancelSignal());
    }

    /**
     * Open the connection. Blocks until the transport connection is open, the handshake is received later on the reader thread.
     * <p> Cancelling {@code signal} closes the connection and stops any reconnect made on behalf of this dial.
     *
     * @param signal Signal bounding the lifetime of this connection and of all its reconnects.
     * @throws SocketConnectedException if the socket isn't closed.
     * @throws EngineIOException if the transport can't connect, or the signal is already cancelled.
     */
    public void dial(CancelSignal signal) {
        if(signal == null)
            throw new NullPointerException("signal");
        if(signal.isCancelled())
            throw new EngineIOException("Engine.IO: dial signal is already cancelled", signal.getCause());
        if(!status.compareAndSet(Status.CLOSED, Status.OPENING))
            throw new SocketConnectedException();

        closeRequested.set(false);
        cancelReconnect();
        lock.writeLock().lock();
        try {
            dialSignal = signal;
            // A CLOSE left over from a close() that never reached the server belongs to the previous lineage.
            sendBuffer.removeIf(packet -> packet.getType() == Type.CLOSE);
        } finally {
            lock.writeLock().unlock();
        }

        Transport.Connection connection;
        try {
            connection = transport.dial(url, config.headerMap, config.dialTimeout);
        } catch (IOException e) {
            status.set(Status.CLOSED);
            logger.warn("Dial to {} failed.", url, e);
            emitSafely(dialErrorHandlers, new DialErrorContext(-1, e), "dial error");
            throw new EngineIOException("Engine.IO: dial to " + url + " failed", e);
        }
        start(connection, signal);
    }

    /**
     * Dial again on behalf of the last {@link #dial(CancelSignal)} call.
     *
     * @return The failure context if the dial failed, null otherwise (also when there was nothing to do).
     */
    private DialErrorContext reDial() {
        if(closeRequested.get() || !status.compareAndSet(Status.CLOSED, Status.OPENING))
            return null;

        CancelSignal signal;
        lock.readLock().lock();
        try {
            signal = dialSignal;
        } finally {
            lock.readLock().unlock();
        }

        Transport.Connection connection;
        try {
            connection = transport.dial(url, config.headerMap, config.dialTimeout);
        } catch (IOException e) {
            int count;
            lock.writeLock().lock();
            try {
                count = ++reDialCount;
            } finally {
                lock.writeLock().unlock();
            }
            status.set(Status.CLOSED);
            logger.warn("Reconnect attempt {} to {} failed: {}", count, url, e.toString());
            DialErrorContext context = new DialErrorContext(count, e);
            emitSafely(dialErrorHandlers, context, "dial error");
            return context;
        }

        if(closeRequested.get() || signal.isCancelled()) {
            connection.close();
            status.set(Status.CLOSED);
            return null;
        }
        start(connection, signal);
        logger.info("Reconnected to {}.", url);
        emitSafely(reconnectHandlers, this, "reconnect");
        return null;
    }

    /**
     * Make a freshly dialed connection the current attempt and start reading from it.
     */
    private void start(Transport.Connection connection, CancelSignal signal) {
        Attempt next = new Attempt(generations.incrementAndGet(), connection, signal.child(),
                                    timedOut -> onClose(timedOut, new PingTimeoutException()));
        lock.writeLock().lock();
        try {
            attempt = next;
            sessionId = "";
            pingInterval = 0;
            pingTimeout = 0;
            maxPayload = 0;
            reDialCount = 0;
            reconnectManager.reset();
        } finally {
            lock.writeLock().unlock();
        }

        // close() was called while dialing.
        if(closeRequested.get())
            next.scheduleForcedClose(() -> onClose(next, null), config.closeTimeout);

        logger.debug("Connection {} to {} is open, waiting for the handshake.", next.generation, url);
        Worker.execute(() -> readLoop(next));
    }

    private void readLoop(Attempt current) {
        Transport.Connection connection = current.connection;
        try {
            while(true) {
                Frame frame;
                try {
                    frame = connection.nextFrame();
                } catch (IOException e) {
                    onClose(current, e);
                    return;
                }

                // Any frame proves the server is alive.
                current.watchdog.reset(getPingDeadline());

                if(frame.isBinary()) {
                    binaryHandlers.emitEvent(frame.getData());
                    continue;
                }

                receiveHandlers.emitEvent(frame.getData());
                Packet packet;
                try {
                    packet = parser.decodePacket(frame.getData());
                } catch (EngineIOParserException e) {
                    onClose(current, e);
                    return;
                }
                logger.trace("Received {}", packet);
                if(!onPacket(current, packet))
                    return;
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error while reading from {}.", url, e);
            onClose(current, e);
        } finally {
            connection.close();
        }
    }

    /**
     * @return false if the reader must stop.
     */
    private boolean onPacket(Attempt current, Packet packet) {
        switch (packet.getType()) {
            case BINARY:
                binaryHandlers.emitEvent(packet.getBody());
                return true;
            case OPEN:
                return onHandshake(current, packet);
            case CLOSE:
                onClose(current, null);
                return false;
            case PING:
                if(status.get() != Status.CONNECTED) {
                    logger.debug("PING received before the handshake, ignored.");
                    return true;
                }
                return write(current, new Packet(Type.PONG, packet.getBody()));
            case PONG:
                pongHandlers.emitEvent(packet.getBody());
                return true;
            case MESSAGE:
                messageHandlers.emitEvent(packet.getBody());
                return true;
            default:
                onClose(current, new EngineIOException("Engine.IO: unsupported packet type " + packet.getType()));
                return false;
        }
    }

    /**
     * Reads given handshake data to setup pingInterval, pingTimeout and sessionId,
     *  flushes the send buffer and starts the ping watchdog.
     */
    private boolean onHandshake(Attempt current, Packet packet) {
        if(status.get() != Status.OPENING) {
            onClose(current, new EngineIOException("Engine.IO: socket was already opened"));
            return false;
        }

        HandshakeData handshakeData;
        try {
            handshakeData = HandshakeData.parseHandshake(packet.getBodyAsString());
        } catch (EngineIOException e) {
            onClose(current, e);
            return false;
        }

        List<byte[]> flushed = new ArrayList<>();
        IOException flushError = null;
        long deadline;
        lock.writeLock().lock();
        try {
            if(current != attempt || current.tornDown)
                return false;

            sessionId = handshakeData.getSessionId();
            pingInterval = handshakeData.getPingInterval();
            pingTimeout = handshakeData.getPingTimeout();
            maxPayload = handshakeData.getMaxPayload();
            deadline = pingInterval + pingTimeout;

            for(Packet buffered : sendBuffer) {
                try {
                    flushed.add(writeFrame(current.connection, buffered));
                } catch (IOException e) {
                    flushError = e;
                    break;
                }
            }
            // Packets that couldn't be written stay for the next connection.
            sendBuffer.subList(0, flushed.size()).clear();
            if(flushError == null)
                status.compareAndSet(Status.OPENING, Status.CONNECTED);
        } finally {
            lock.writeLock().unlock();
        }

        flushed.forEach(sendHandlers::emitEvent);
        if(flushError != null) {
            onClose(current, flushError);
            return false;
        }

        current.watchdog.start(deadline);
        logger.info("Connected to {}, {}", url, handshakeData);
        connectHandlers.emitEvent(this);
        return true;
    }

    /**
     * Tear down the given connection attempt. Only the first call for the current attempt has an effect,
     *  calls for an attempt that was replaced by a newer dial are ignored.
     * <p> Reconnects when {@code err} isn't null, unless {@link #close()} was called or the dial signal is cancelled.
     *
     * @param closing The attempt to close.
     * @param err Why the connection ended, null for an orderly close.
     */
    void onClose(Attempt closing, Throwable err) {
        CancelSignal lineage;
        lock.writeLock().lock();
        try {
            if(closing != attempt || closing.tornDown)
                return;
            closing.tornDown = true;
            if(status.getAndSet(Status.CLOSED) == Status.CLOSED)
                return;
            lineage = dialSignal;
        } finally {
            lock.writeLock().unlock();
        }

        closing.signal.cancel(err);
        if(err == null)
            logger.info("Disconnected from {}.", url);
        else
            logger.warn("Disconnected from {}: {}", url, err.toString());

        emitSafely(disconnectHandlers, err, "disconnect");
        if(err != null && config.reconnect && !closeRequested.get())
            scheduleReconnect(lineage);
    }

    private void scheduleReconnect(CancelSignal lineage) {
        if(lineage.isCancelled() || closeRequested.get())
            return;

        long delay;
        int attemptNumber;
        lock.writeLock().lock();
        try {
            delay = reconnectManager.calculateDelay();
            attemptNumber = reconnectManager.reconnectsAttempted;
        } finally {
            lock.writeLock().unlock();
        }

        ReconnectTask task = new ReconnectTask(lineage);
        ReconnectTask previous = reconnectTask.getAndSet(task);
        if(previous != null)
            previous.cancel();
        logger.debug("Reconnect attempt {} to {} in {} ms.", attemptNumber, url, delay);
        task.arm(delay);
    }

    /**
     * Emit an event that teardown or reconnect scheduling follows. A failing listener is logged and doesn't stop the caller.
     */
    private <T> void emitSafely(Observable<T> handlers, T arg, String event) {
        try {
            handlers.emitEvent(arg);
        } catch (RuntimeException e) {
            logger.error("A {} listener of {} failed.", event, url, e);
        }
    }

    private void cancelReconnect() {
        ReconnectTask task = reconnectTask.getAndSet(null);
        if(task != null)
            task.cancel();
    }

    /**
     * Initiate an orderly close: cancels any pending reconnect and, if not closed, sends a CLOSE packet.
     * The connection is torn down when the server closes it, or after {@link Config#closeTimeout} if it doesn't.
     * No reconnect happens after this call, until the next {@link #dial()}.
     */
    public void close() {
        boolean alreadyClosing = closeRequested.getAndSet(true);
        cancelReconnect();
        if(status.get() == Status.CLOSED || alreadyClosing)
            return;

        logger.info("Closing connection to {}.", url);
        send(Packet.CLOSE);
        Attempt current = currentAttempt();
        if(current != null)
            current.scheduleForcedClose(() -> onClose(current, null), config.closeTimeout);
    }

    /**
     * Send a MESSAGE packet. Buffered until the next handshake if not connected.
     */
    public void emit(byte[] body) {
        send(new Packet(Type.MESSAGE, body));
    }

    public void emit(String body) {
        send(new Packet(Type.MESSAGE, body));
    }

    /**
     * Send {@code body} as a binary frame. Buffered until the next handshake if not connected.
     */
    public void emitBinary(byte[] body) {
        send(new Packet(Type.BINARY, body));
    }

    private void send(Packet packet) {
        Attempt current;
        lock.writeLock().lock();
        try {
            if(status.get() != Status.CONNECTED) {
                sendBuffer.add(packet);
                return;
            }
            current = attempt;
        } finally {
            lock.writeLock().unlock();
        }
        write(current, packet);
    }

    /**
     * Write a packet and notify send listeners. Closes the attempt if the write fails.
     *
     * @return false if the write failed.
     */
    private boolean write(Attempt current, Packet packet) {
        byte[] data;
        try {
            data = writeFrame(current.connection, packet);
        } catch (IOException e) {
            onClose(current, e);
            return false;
        }
        sendHandlers.emitEvent(data);
        return true;
    }

    private byte[] writeFrame(Transport.Connection connection, Packet packet) throws IOException {
        byte[] data = parser.encodePacket(packet);
        connection.write(packet.isBinary() ? Frame.binary(data) : Frame.text(data));
        return data;
    }

    private long getPingDeadline() {
        lock.readLock().lock();
        try {
            return pingInterval + pingTimeout;
        } finally {
            lock.readLock().unlock();
        }
    }

    Attempt currentAttempt() {
        lock.readLock().lock();
        try {
            return attempt;
        } finally {
            lock.readLock().unlock();
        }
    }

    int bufferedPacketCount() {
        lock.readLock().lock();
        try {
            return sendBuffer.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Status getStatus() {
        return status.get();
    }

    public boolean isConnected() {
        return getStatus() == Status.CONNECTED;
    }

    /**
     * @return Session id from the last handshake, empty until the current connection receives one.
     */
    public String getSessionId() {
        lock.readLock().lock();
        try {
            return sessionId;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getPingInterval() {
        lock.readLock().lock();
        try {
            return pingInterval;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getPingTimeout() {
        lock.readLock().lock();
        try {
            return pingTimeout;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxPayload() {
        lock.readLock().lock();
        try {
            return maxPayload;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getUrl() {
        return url;
    }

    public CallbackHandle onConnect(Callback<EngineSocket> callback) {
        return connectHandlers.on(callback);
    }

    public CallbackHandle onceConnect(Callback<EngineSocket> callback) {
        return connectHandlers.once(callback);
    }

    public CallbackHandle onDisconnect(Callback<Throwable> callback) {
        return disconnectHandlers.on(callback);
    }

    public CallbackHandle onceDisconnect(Callback<Throwable> callback) {
        return disconnectHandlers.once(callback);
    }

    public CallbackHandle onDialError(Callback<DialErrorContext> callback) {
        return dialErrorHandlers.on(callback);
    }

    public CallbackHandle onceDialError(Callback<DialErrorContext> callback) {
        return dialErrorHandlers.once(callback);
    }

    public CallbackHandle onReconnect(Callback<EngineSocket> callback) {
        return reconnectHandlers.on(callback);
    }

    public CallbackHandle onceReconnect(Callback<EngineSocket> callback) {
        return reconnectHandlers.once(callback);
    }

    public CallbackHandle onPong(Callback<byte[]> callback) {
        return pongHandlers.on(callback);
    }

    public CallbackHandle oncePong(Callback<byte[]> callback) {
        return pongHandlers.once(callback);
    }

    public CallbackHandle onBinary(Callback<byte[]> callback) {
        return binaryHandlers.on(callback);
    }

    public CallbackHandle onceBinary(Callback<byte[]> callback) {
        return binaryHandlers.once(callback);
    }

    public CallbackHandle onMessage(Callback<byte[]> callback) {
        return messageHandlers.on(callback);
    }

    public CallbackHandle onceMessage(Callback<byte[]> callback) {
        return messageHandlers.once(callback);
    }

    /**
     * Raw bytes of every received text frame, before it is decoded.
     */
    public CallbackHandle onReceive(Callback<byte[]> callback) {
        return receiveHandlers.on(callback);
    }

    public CallbackHandle onceReceive(Callback<byte[]> callback) {
        return receiveHandlers.once(callback);
    }

    /**
     * Raw bytes of every written packet.
     */
    public CallbackHandle onSend(Callback<byte[]> callback) {
        return sendHandlers.on(callback);
    }

    public CallbackHandle onceSend(Callback<byte[]> callback) {
        return sendHandlers.once(callback);
    }

    /**
     * A scheduled reconnect. Only the task held by {@link #reconnectTask} may dial, a replaced or cancelled one does nothing when it fires.
     */
    private final class ReconnectTask {

        private final CancelSignal lineage;
        private ScheduledFuture<?> future;
        private CancelSignal.Registration registration;

        private ReconnectTask(CancelSignal lineage) {
            this.lineage = lineage;
        }

        private synchronized void arm(long delay) {
            future = Worker.schedule(this::fire, delay);
            registration = lineage.onCancel(() -> {
                if(reconnectTask.compareAndSet(this, null))
                    cancel();
            });
        }

        private synchronized void cancel() {
            if(future != null)
                future.cancel(false);
            if(registration != null)
                registration.remove();
        }

        private void fire() {
            synchronized (this) {
                if(registration != null)
                    registration.remove();
            }
            if(!reconnectTask.compareAndSet(this, null) || lineage.isCancelled() || closeRequested.get())
                return;

            // Dialing blocks, keep it off the scheduler thread.
            Worker.execute(() -> {
                DialErrorContext failure = reDial();
                if(failure == null)
                    return;
                if(failure.isReDialCancelled())
                    logger.info("Reconnecting to {} was cancelled after {} attempts.", url, failure.getCount());
                else
                    scheduleReconnect(lineage);
            });
        }
    }
}
