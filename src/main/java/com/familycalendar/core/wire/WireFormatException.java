package com.familycalendar.core.wire;

/**
 * An inbound frame could not be decoded as a {@link WireMessage}.
 */
public class WireFormatException extends Exception {

    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
