package com.familycalendar.dispatch.ws;

/**
 * Lifecycle of a {@link ConnectionSession}. Transitions only move forward.
 */
public enum SessionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
