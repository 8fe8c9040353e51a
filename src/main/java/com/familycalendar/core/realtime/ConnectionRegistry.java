package com.familycalendar.core.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks live websocket connections by a random 128-bit id.
 * <p>
 * Each entry maps a connection id to that connection's private {@link OutboundChannel}. The lock
 * is held only for the single insert, lookup or removal.
 */
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<UUID, OutboundChannel> connections = new HashMap<>();

    /**
     * Stores the channel under a freshly generated id. The caller keeps the id for the
     * lifetime of the connection.
     */
    public UUID register(OutboundChannel outbound) {
        UUID id;
        lock.lock();
        try {
            do {
                id = UUID.randomUUID();
            } while (connections.containsKey(id));
            connections.put(id, outbound);
        } finally {
            lock.unlock();
        }
        log.debug("Registered connection {}", id);
        return id;
    }

    /**
     * Drops the entry for {@code id}. Unknown ids are ignored.
     */
    public void remove(UUID id) {
        OutboundChannel removed;
        lock.lock();
        try {
            removed = connections.remove(id);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.debug("Removed connection {}", id);
        }
    }

    /**
     * Queues a frame on one connection's private channel.
     *
     * @return false if the id is not registered or its channel is closed
     */
    public boolean sendTo(UUID id, byte[] frame) {
        OutboundChannel outbound;
        lock.lock();
        try {
            outbound = connections.get(id);
        } finally {
            lock.unlock();
        }
        return outbound != null && outbound.send(frame);
    }

    public boolean contains(UUID id) {
        lock.lock();
        try {
            return connections.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }
}
