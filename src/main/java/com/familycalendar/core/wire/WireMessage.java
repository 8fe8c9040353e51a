package com.familycalendar.core.wire;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A frame on the live-update channel: a short kind tag plus opaque payload bytes.
 *
 * @param kind    message kind, e.g. {@value #ECHO} or {@value #BROADCAST}
 * @param payload raw payload bytes
 */
public record WireMessage(String kind, byte[] payload) {

    public static final String ECHO = "echo";
    public static final String BROADCAST = "broadcast";
    public static final String ERROR = "error";

    public WireMessage {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
    }

    public static WireMessage error(String diagnostic) {
        return new WireMessage(ERROR, diagnostic.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean isKind(String expected) {
        return kind.equals(expected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WireMessage other)) return false;
        return kind.equals(other.kind) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "WireMessage[kind=" + kind + ", payload=" + payload.length + " bytes]";
    }
}
