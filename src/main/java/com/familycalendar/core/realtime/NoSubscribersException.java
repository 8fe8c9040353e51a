package com.familycalendar.core.realtime;

/**
 * Thrown by {@link BroadcastHub#publish(byte[])} when nobody is subscribed. Publishing to an
 * empty room is valid; callers should not treat this as a failure.
 */
public class NoSubscribersException extends Exception {

    public NoSubscribersException() {
        super("No active subscribers on the broadcast channel");
    }
}
