package com.familycalendar.core.realtime;

import java.time.Duration;
import java.util.Optional;

/**
 * One subscriber's read position on the {@link BroadcastHub}.
 * <p>
 * Meant to be drained by a single thread. Closing releases the slot in the hub; a closed
 * subscription no longer counts as a receiver.
 */
public final class HubSubscription implements AutoCloseable {

    private final BroadcastHub hub;
    private final Runnable onPublish;

    /** Sequence number of the next payload to read. Guarded by the hub lock. */
    private long position;
    private volatile boolean closed;

    HubSubscription(BroadcastHub hub, long position, Runnable onPublish) {
        this.hub = hub;
        this.position = position;
        this.onPublish = onPublish;
    }

    /**
     * Returns the next payload if one is ready.
     *
     * @throws LaggedException once, if payloads were overwritten before this subscriber read them
     */
    public Optional<byte[]> tryReceive() throws LaggedException {
        return Optional.ofNullable(hub.poll(this));
    }

    /**
     * Blocks until the next payload is published.
     *
     * @throws LaggedException once, if payloads were overwritten before this subscriber read them
     */
    public byte[] receive() throws LaggedException, InterruptedException {
        return hub.await(this, -1);
    }

    /**
     * Waits up to {@code timeout} for the next payload.
     */
    public Optional<byte[]> receive(Duration timeout) throws LaggedException, InterruptedException {
        return Optional.ofNullable(hub.await(this, timeout.toNanos()));
    }

    void notifyPublished() {
        if (onPublish != null && !closed) {
            onPublish.run();
        }
    }

    long position() {
        return position;
    }

    void moveTo(long next) {
        this.position = next;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            hub.unsubscribe(this);
        }
    }
}
