package com.familycalendar.dispatch.ws;

import com.familycalendar.core.logging.MdcContext;
import com.familycalendar.core.metrics.CalendarMetrics;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.realtime.HubSubscription;
import com.familycalendar.core.realtime.LaggedException;
import com.familycalendar.core.realtime.NoSubscribersException;
import com.familycalendar.core.realtime.OutboundChannel;
import com.familycalendar.core.wire.WireCodec;
import com.familycalendar.core.wire.WireFormatException;
import com.familycalendar.core.wire.WireMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One client connection on the live-update channel, from upgrade to teardown.
 * <p>
 * While {@link SessionState#OPEN} two duties run side by side:
 * <ul>
 *   <li>inbound, driven by the container through {@link #handleInbound(WebSocketMessage)}:
 *       decodes each frame and either echoes it on the private channel, publishes the raw
 *       bytes to the {@link BroadcastHub}, or replies with an {@code error} frame;</li>
 *   <li>outbound, a worker-pool task that merges the private {@link OutboundChannel} and the
 *       hub subscription onto the socket.</li>
 * </ul>
 * A broadcast reaches the sender too, through its own hub subscription. Echo and error replies
 * and hub deliveries are merged as they arrive, with no ordering between the two streams.
 * <p>
 * {@link #close(CloseStatus)} deregisters the connection, releases the subscription and waits
 * for both duties to stop before the session reports {@link SessionState#CLOSED}.
 */
public class ConnectionSession {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    private final WebSocketSession socket;
    private final ConnectionRegistry registry;
    private final BroadcastHub hub;
    private final WireCodec codec;
    private final CalendarMetrics metrics;
    private final ExecutorService executor;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final OutboundChannel outbound = new OutboundChannel();
    private final ReentrantLock inboundLock = new ReentrantLock();
    private final CountDownLatch outboundStopped = new CountDownLatch(1);

    private volatile UUID id;
    private volatile HubSubscription subscription;

    public ConnectionSession(WebSocketSession socket, ConnectionRegistry registry, BroadcastHub hub,
                             WireCodec codec, CalendarMetrics metrics, ExecutorService executor) {
        this.socket = socket;
        this.registry = registry;
        this.hub = hub;
        this.codec = codec;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Registers the connection, subscribes to the hub and starts the outbound duty.
     */
    public void open() {
        id = registry.register(outbound);
        subscription = hub.subscribe(outbound::wake);

        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.OPEN)) {
            // closed while still connecting
            registry.remove(id);
            subscription.close();
            outboundStopped.countDown();
            return;
        }
        metrics.recordConnectionOpened();
        log.info("Connection {} open (socket {})", id, socket.getId());

        try {
            executor.execute(this::runOutbound);
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected outbound duty for connection {}", id);
            outboundStopped.countDown();
            close(CloseStatus.SERVER_ERROR);
        }
    }

    /**
     * Routes one inbound frame. Frames arriving after the session left {@code OPEN} are dropped.
     */
    public void handleInbound(WebSocketMessage<?> message) {
        inboundLock.lock();
        try {
            if (state.get() != SessionState.OPEN) {
                log.debug("Dropping inbound frame on connection {} in state {}", id, state.get());
                return;
            }
            if (message instanceof BinaryMessage binary) {
                route(toBytes(binary.getPayload()));
            } else if (message instanceof TextMessage text) {
                route(text.asBytes());
            } else if (message instanceof PingMessage ping) {
                sendPong(ping.getPayload());
            } else if (message instanceof PongMessage) {
                log.trace("Pong on connection {}", id);
            }
        } finally {
            inboundLock.unlock();
        }
    }

    private void route(byte[] raw) {
        WireMessage message;
        try {
            message = codec.decode(raw);
        } catch (WireFormatException e) {
            log.debug("Malformed frame on connection {}: {}", id, e.getMessage());
            metrics.recordInboundFrame("malformed");
            reply(WireMessage.error(WireCodec.MALFORMED_FRAME));
            return;
        }

        if (message.isKind(WireMessage.ECHO)) {
            metrics.recordInboundFrame(WireMessage.ECHO);
            // sent back as received, so the client gets its own encoding
            reply(message.kind(), raw);
        } else if (message.isKind(WireMessage.BROADCAST)) {
            metrics.recordInboundFrame(WireMessage.BROADCAST);
            try {
                int receivers = hub.publish(raw);
                log.trace("Broadcast from {} reached {} subscriber(s)", id, receivers);
            } catch (NoSubscribersException e) {
                log.debug("Broadcast from {} had no subscribers", id);
            }
        } else {
            log.debug("Unknown message kind '{}' on connection {}", message.kind(), id);
            metrics.recordInboundFrame("unknown");
            reply(WireMessage.error(WireCodec.UNKNOWN_KIND));
        }
    }

    private void reply(WireMessage message) {
        reply(message.kind(), codec.encode(message));
    }

    private void reply(String kind, byte[] frame) {
        if (!outbound.send(frame)) {
            log.debug("Reply '{}' dropped; connection {} is closing", kind, id);
        }
    }

    private void sendPong(ByteBuffer payload) {
        try {
            socket.sendMessage(new PongMessage(payload));
        } catch (IOException | RuntimeException e) {
            log.debug("Pong to connection {} failed: {}", id, e.getMessage());
            close(CloseStatus.SERVER_ERROR);
        }
    }

    private void runOutbound() {
        MdcContext.setConnection(String.valueOf(id));
        try {
            while (state.get() == SessionState.OPEN) {
                byte[] frame = outbound.poll();
                if (frame == null) {
                    try {
                        frame = subscription.tryReceive().orElse(null);
                    } catch (LaggedException e) {
                        log.warn("Connection {} fell behind the broadcast channel; {} message(s) skipped",
                                id, e.getSkipped());
                        metrics.recordLagged(e.getSkipped());
                        continue;
                    }
                }
                if (frame == null) {
                    outbound.awaitSignal();
                    continue;
                }
                socket.sendMessage(new BinaryMessage(frame));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            log.debug("Send to connection {} failed: {}", id, e.getMessage());
        } finally {
            MdcContext.clear();
            outboundStopped.countDown();
            close(CloseStatus.SERVER_ERROR);
        }
    }

    /**
     * Moves the session out of {@code OPEN} and tears it down. Only the first call does the
     * work; later calls return immediately.
     *
     * @param status close status echoed to the peer if the socket is still open
     */
    public void close(CloseStatus status) {
        SessionState previous = state.getAndUpdate(s ->
                s == SessionState.CONNECTING || s == SessionState.OPEN ? SessionState.CLOSING : s);
        if (previous == SessionState.CLOSING || previous == SessionState.CLOSED) {
            return;
        }
        if (previous == SessionState.CONNECTING) {
            // open() sees the failed transition and releases what it acquired
            state.set(SessionState.CLOSED);
            return;
        }

        registry.remove(id);
        subscription.close();
        outbound.close();

        if (socket.isOpen()) {
            try {
                socket.close(status);
            } catch (IOException e) {
                log.debug("Closing socket of connection {} failed: {}", id, e.getMessage());
            }
        }

        // wait for an in-flight inbound frame, then for the outbound duty
        inboundLock.lock();
        inboundLock.unlock();
        try {
            outboundStopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        state.set(SessionState.CLOSED);
        metrics.recordConnectionClosed();
        log.info("Connection {} closed ({})", id, status);
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }

    public UUID getId() {
        return id;
    }

    public SessionState getState() {
        return state.get();
    }
}
