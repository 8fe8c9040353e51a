package com.familycalendar.core.realtime;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;

/**
 * Unbounded private queue of outbound frames for one connection.
 * <p>
 * Producers never block. The single consumer drains with {@link #poll()} and parks in
 * {@link #awaitSignal()} when there is nothing to do; {@link #wake()} lets another source
 * (the hub subscription) share the same wake-up signal so one thread can merge both.
 */
public class OutboundChannel {

    private final Queue<byte[]> frames = new ConcurrentLinkedQueue<>();
    private final Semaphore signal = new Semaphore(0);
    private volatile boolean closed;

    /**
     * Enqueues a frame.
     *
     * @return false if the channel is closed and the frame was dropped
     */
    public boolean send(byte[] frame) {
        if (closed) {
            return false;
        }
        frames.add(frame);
        signal.release();
        return true;
    }

    /**
     * Next queued frame, or null when the queue is empty.
     */
    public byte[] poll() {
        return frames.poll();
    }

    public void wake() {
        signal.release();
    }

    /**
     * Parks until something was sent, {@link #wake()} was called, or the channel was closed
     * since the last call.
     */
    public void awaitSignal() throws InterruptedException {
        signal.acquire();
        signal.drainPermits();
    }

    public void close() {
        closed = true;
        signal.release();
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return frames.size();
    }
}
