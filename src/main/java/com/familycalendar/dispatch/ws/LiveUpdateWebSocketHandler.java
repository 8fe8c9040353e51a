package com.familycalendar.dispatch.ws;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.metrics.CalendarMetrics;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.wire.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Container-facing adapter for the live-update endpoint. Each upgraded socket gets its own
 * {@link ConnectionSession}; every callback is forwarded to it.
 */
@Component
public class LiveUpdateWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(LiveUpdateWebSocketHandler.class);

    private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

    private final ConnectionRegistry registry;
    private final BroadcastHub hub;
    private final WireCodec codec;
    private final CalendarMetrics metrics;
    private final ExecutorService workerPool;
    private final CalendarProperties.Realtime realtime;

    public LiveUpdateWebSocketHandler(ConnectionRegistry registry, BroadcastHub hub, WireCodec codec,
                                      CalendarMetrics metrics,
                                      @Qualifier("calendarWorkerPool") ExecutorService workerPool,
                                      CalendarProperties properties) {
        this.registry = registry;
        this.hub = hub;
        this.codec = codec;
        this.metrics = metrics;
        this.workerPool = workerPool;
        this.realtime = properties.getRealtime();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) {
        // sends from the outbound duty and pongs from the inbound side share one socket
        var decorated = new ConcurrentWebSocketSessionDecorator(socket,
                (int) realtime.getSendTimeLimit().toMillis(),
                (int) realtime.getSendBufferSizeLimit().toBytes());
        var session = new ConnectionSession(decorated, registry, hub, codec, metrics, workerPool);
        sessions.put(socket.getId(), session);
        session.open();
    }

    @Override
    public void handleMessage(WebSocketSession socket, WebSocketMessage<?> message) {
        ConnectionSession session = sessions.get(socket.getId());
        if (session == null) {
            log.debug("Frame on unknown socket {}", socket.getId());
            return;
        }
        session.handleInbound(message);
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        log.debug("Transport error on socket {}: {}", socket.getId(), exception.getMessage());
        ConnectionSession session = sessions.remove(socket.getId());
        if (session != null) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        ConnectionSession session = sessions.remove(socket.getId());
        if (session != null) {
            session.close(status);
        }
    }

    public int activeSessionCount() {
        return sessions.size();
    }
}
