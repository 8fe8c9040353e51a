package com.familycalendar.dispatch.ws;

import com.familycalendar.core.metrics.CalendarMetrics;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.wire.WireCodec;
import com.familycalendar.core.wire.WireMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionSessionTest {

    private final WireCodec codec = new WireCodec();

    private ExecutorService executor;
    private ConnectionRegistry registry;
    private BroadcastHub hub;
    private CalendarMetrics metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new ConnectionRegistry();
        hub = new BroadcastHub(64);
        metrics = new CalendarMetrics(new SimpleMeterRegistry(), registry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** A mocked socket that records every message the session sends. */
    private static final class FakeSocket {
        final WebSocketSession socket = mock(WebSocketSession.class);
        final BlockingQueue<WebSocketMessage<?>> sent = new LinkedBlockingQueue<>();

        FakeSocket(String id) throws IOException {
            when(socket.getId()).thenReturn(id);
            when(socket.isOpen()).thenReturn(true);
            doAnswer(inv -> {
                sent.add(inv.getArgument(0));
                return null;
            }).when(socket).sendMessage(any());
        }

        WebSocketMessage<?> next() throws InterruptedException {
            WebSocketMessage<?> message = sent.poll(5, TimeUnit.SECONDS);
            assertNotNull(message, "expected an outbound frame");
            return message;
        }
    }

    private ConnectionSession open(FakeSocket fake) {
        var session = new ConnectionSession(fake.socket, registry, hub, codec, metrics, executor);
        session.open();
        return session;
    }

    private BinaryMessage frame(String kind, String payload) {
        return new BinaryMessage(codec.encode(new WireMessage(kind, payload.getBytes(StandardCharsets.UTF_8))));
    }

    private WireMessage decode(WebSocketMessage<?> message) throws Exception {
        return codec.decode(bytes(message));
    }

    private static byte[] bytes(WebSocketMessage<?> message) {
        ByteBuffer buffer = ((BinaryMessage) message).getPayload();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }

    private static String text(WireMessage message) {
        return new String(message.payload(), StandardCharsets.UTF_8);
    }

    private static void awaitState(ConnectionSession session, SessionState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (session.getState() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, session.getState());
    }

    @Nested
    @DisplayName("open")
    class OpenTests {

        @Test
        @DisplayName("registers the connection and subscribes to the hub")
        void registersAndSubscribes() throws Exception {
            var session = open(new FakeSocket("s1"));

            assertEquals(SessionState.OPEN, session.getState());
            assertTrue(registry.contains(session.getId()));
            assertEquals(1, hub.subscriberCount());
        }

        @Test
        @DisplayName("point-to-point frames reach the socket")
        void sendToReachesSocket() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);

            assertTrue(registry.sendTo(session.getId(), codec.encode(new WireMessage("echo", new byte[]{1}))));

            assertEquals(new WireMessage("echo", new byte[]{1}), decode(fake.next()));
        }
    }

    @Nested
    @DisplayName("inbound routing")
    class RoutingTests {

        @Test
        @DisplayName("echo returns the message to the sender only")
        void echo() throws Exception {
            var a = new FakeSocket("a");
            var b = new FakeSocket("b");
            var sessionA = open(a);
            open(b);

            sessionA.handleInbound(frame("echo", "hi"));

            WireMessage reply = decode(a.next());
            assertEquals("echo", reply.kind());
            assertEquals("hi", text(reply));
            assertNull(b.sent.poll(100, TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("echo returns the sender's own encoding")
        void echoKeepsArrayForm() throws Exception {
            var a = new FakeSocket("a");
            var sessionA = open(a);
            byte[] arrayForm = {(byte) 0x92, (byte) 0xa4, 'e', 'c', 'h', 'o', (byte) 0xc4, 0x02, 'h', 'i'};

            sessionA.handleInbound(new BinaryMessage(arrayForm));

            assertArrayEquals(arrayForm, bytes(a.next()));
            assertNull(a.sent.poll(100, TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("broadcast reaches every connection, the sender included")
        void broadcast() throws Exception {
            var a = new FakeSocket("a");
            var b = new FakeSocket("b");
            var sessionA = open(a);
            open(b);

            sessionA.handleInbound(frame("broadcast", "dinner at 7"));

            for (FakeSocket socket : new FakeSocket[]{a, b}) {
                WireMessage received = decode(socket.next());
                assertEquals("broadcast", received.kind());
                assertEquals("dinner at 7", text(received));
            }
            assertNull(a.sent.poll(100, TimeUnit.MILLISECONDS));
            assertNull(b.sent.poll(100, TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("unknown kind gets an error reply and the session stays open")
        void unknownKind() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);

            session.handleInbound(frame("teleport", "x"));
            WireMessage error = decode(fake.next());

            assertEquals(WireMessage.error(WireCodec.UNKNOWN_KIND), error);
            assertEquals(SessionState.OPEN, session.getState());

            session.handleInbound(frame("echo", "still here"));
            assertEquals("still here", text(decode(fake.next())));
        }

        @Test
        @DisplayName("malformed frame gets an error reply")
        void malformedFrame() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);

            session.handleInbound(new BinaryMessage(new byte[]{(byte) 0xc1, 0x00}));

            assertEquals(WireMessage.error(WireCodec.MALFORMED_FRAME), decode(fake.next()));
            assertEquals(SessionState.OPEN, session.getState());
        }

        @Test
        @DisplayName("ping is answered with a pong carrying the same payload")
        void pingPong() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);

            session.handleInbound(new PingMessage(ByteBuffer.wrap(new byte[]{7, 7})));

            WebSocketMessage<?> reply = fake.next();
            assertInstanceOf(PongMessage.class, reply);
            assertEquals(ByteBuffer.wrap(new byte[]{7, 7}), reply.getPayload());
        }

        @Test
        @DisplayName("pong frames are ignored")
        void pongIgnored() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);

            session.handleInbound(new PongMessage(ByteBuffer.wrap(new byte[]{1})));

            assertNull(fake.sent.poll(100, TimeUnit.MILLISECONDS));
            assertEquals(SessionState.OPEN, session.getState());
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("deregisters, unsubscribes and echoes the close status")
        void closeTearsDown() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);

            session.close(CloseStatus.NORMAL);

            assertEquals(SessionState.CLOSED, session.getState());
            assertFalse(registry.contains(session.getId()));
            assertEquals(0, hub.subscriberCount());
            verify(fake.socket).close(CloseStatus.NORMAL);
        }

        @Test
        @DisplayName("frames after close are dropped")
        void framesAfterCloseDropped() throws Exception {
            var fake = new FakeSocket("s1");
            var session = open(fake);
            session.close(CloseStatus.NORMAL);

            session.handleInbound(frame("echo", "late"));

            assertNull(fake.sent.poll(100, TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("closing twice is harmless")
        void closeIsIdempotent() throws Exception {
            var session = open(new FakeSocket("s1"));

            session.close(CloseStatus.NORMAL);
            session.close(CloseStatus.GOING_AWAY);

            assertEquals(SessionState.CLOSED, session.getState());
        }

        @Test
        @DisplayName("a failed send tears the session down")
        void sendFailureCloses() throws Exception {
            var fake = new FakeSocket("s1");
            doThrow(new IOException("broken pipe")).when(fake.socket).sendMessage(any());
            var session = open(fake);

            session.handleInbound(frame("echo", "boom"));

            awaitState(session, SessionState.CLOSED);
            assertEquals(0, registry.size());
            assertEquals(0, hub.subscriberCount());
        }
    }
}
