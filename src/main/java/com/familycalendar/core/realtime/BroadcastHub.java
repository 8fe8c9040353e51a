package com.familycalendar.core.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single shared fan-out channel for binary payloads.
 * <p>
 * Published payloads go into a ring of {@code capacity} slots, each identified by a
 * monotonically increasing sequence number. Every {@link HubSubscription} keeps its own read
 * position, so subscribers see payloads in publish order and advance independently. A publisher
 * never waits for a slow subscriber: once a subscriber is more than {@code capacity} messages
 * behind, its next receive reports a single {@link LaggedException} covering everything it missed
 * and moves it to the current head, so it only sees payloads published after the report.
 * <p>
 * A slot is released as soon as no subscriber still has to read it.
 */
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    public static final int DEFAULT_CAPACITY = 1024;

    private final int capacity;
    private final byte[][] slots;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();

    /** Sequence number the next publish will take. Guarded by {@link #lock}. */
    private long tail = 0;

    /** Every slot below this sequence number has been released. Guarded by {@link #lock}. */
    private long released = 0;

    private final CopyOnWriteArrayList<HubSubscription> subscribers = new CopyOnWriteArrayList<>();

    public BroadcastHub() {
        this(DEFAULT_CAPACITY);
    }

    public BroadcastHub(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.slots = new byte[capacity][];
    }

    /**
     * Appends a payload for every current subscriber.
     *
     * @param payload bytes to fan out; copied, so the caller may reuse the array
     * @return the number of subscribers the payload was made available to
     * @throws NoSubscribersException if nobody is subscribed; the payload is discarded
     */
    public int publish(byte[] payload) throws NoSubscribersException {
        byte[] copy = Arrays.copyOf(payload, payload.length);
        int receivers;
        lock.lock();
        try {
            receivers = subscribers.size();
            if (receivers == 0) {
                throw new NoSubscribersException();
            }
            slots[slot(tail)] = copy;
            tail++;
            published.signalAll();
        } finally {
            lock.unlock();
        }

        for (HubSubscription subscriber : subscribers) {
            subscriber.notifyPublished();
        }
        log.trace("Published {} byte(s) to {} subscriber(s)", copy.length, receivers);
        return receivers;
    }

    /**
     * Subscribes at the current head; only payloads published from now on are delivered.
     */
    public HubSubscription subscribe() {
        return subscribe(null);
    }

    /**
     * Subscribes at the current head and calls {@code onPublish} after every publish, outside
     * the hub lock. Lets a consumer merging several sources park on a single signal.
     */
    public HubSubscription subscribe(Runnable onPublish) {
        lock.lock();
        try {
            var subscription = new HubSubscription(this, tail, onPublish);
            subscribers.add(subscription);
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    void unsubscribe(HubSubscription subscription) {
        lock.lock();
        try {
            subscribers.remove(subscription);
            releaseConsumed();
            published.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next payload for {@code subscription}, or null if it is caught up.
     */
    byte[] poll(HubSubscription subscription) throws LaggedException {
        lock.lock();
        try {
            if (subscription.position() == tail) {
                return null;
            }
            return take(subscription);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeoutNanos} (forever if negative) for the next payload.
     *
     * @return the payload, or null on timeout
     */
    byte[] await(HubSubscription subscription, long timeoutNanos)
            throws LaggedException, InterruptedException {
        long nanos = timeoutNanos;
        lock.lockInterruptibly();
        try {
            while (subscription.position() == tail) {
                if (subscription.isClosed()) {
                    throw new IllegalStateException("Subscription is closed");
                }
                if (timeoutNanos < 0) {
                    published.await();
                } else {
                    if (nanos <= 0) {
                        return null;
                    }
                    nanos = published.awaitNanos(nanos);
                }
            }
            return take(subscription);
        } finally {
            lock.unlock();
        }
    }

    private byte[] take(HubSubscription subscription) throws LaggedException {
        long oldest = Math.max(0, tail - capacity);
        long position = subscription.position();
        if (position < oldest) {
            subscription.moveTo(tail);
            releaseConsumed();
            throw new LaggedException(tail - position);
        }
        byte[] payload = slots[slot(position)];
        subscription.moveTo(position + 1);
        releaseConsumed();
        return payload;
    }

    /**
     * Drops payload references that every remaining subscriber has moved past. Caller holds
     * {@link #lock}.
     */
    private void releaseConsumed() {
        long lowest = tail;
        for (HubSubscription subscriber : subscribers) {
            lowest = Math.min(lowest, subscriber.position());
        }
        for (long seq = Math.max(released, tail - capacity); seq < lowest; seq++) {
            slots[slot(seq)] = null;
        }
        released = Math.max(released, lowest);
    }

    /**
     * Number of slots currently holding a payload.
     */
    int retainedCount() {
        lock.lock();
        try {
            int count = 0;
            for (byte[] slot : slots) {
                if (slot != null) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    private int slot(long sequence) {
        return (int) (sequence % capacity);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public int capacity() {
        return capacity;
    }
}
