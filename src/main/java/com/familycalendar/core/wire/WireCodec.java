package com.familycalendar.core.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.core.MessagePackException;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MessagePack encoding of {@link WireMessage}.
 * <p>
 * Frames are written as a map {@code {"kind": str, "payload": bin}}. Reading is lenient: besides
 * the map form (unknown keys are ignored) it accepts the compact array form
 * {@code [kind, payload]}, and a payload given as an array of byte values instead of {@code bin}.
 * Frames the server builds itself, such as error replies, always use the map form; an echo reply
 * carries the client's own bytes back unchanged.
 */
@Component
public class WireCodec {

    public static final String UNKNOWN_KIND = "Unknown message kind";
    public static final String MALFORMED_FRAME = "Invalid MessagePack";

    private final ObjectMapper mapper = new ObjectMapper(new MessagePackFactory());

    public byte[] encode(WireMessage message) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("kind", message.kind());
        frame.put("payload", message.payload());
        try {
            return mapper.writeValueAsBytes(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode " + message, e);
        }
    }

    public WireMessage decode(byte[] frame) throws WireFormatException {
        if (frame == null || frame.length == 0) {
            throw new WireFormatException("Empty frame");
        }

        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (IOException | MessagePackException e) {
            // msgpack-core reports bad format bytes and truncation unchecked
            throw new WireFormatException("Frame is not valid MessagePack", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new WireFormatException("Frame is empty");
        }

        JsonNode kind;
        JsonNode payload;
        if (root.isObject()) {
            kind = root.get("kind");
            payload = root.get("payload");
        } else if (root.isArray() && root.size() >= 2) {
            kind = root.get(0);
            payload = root.get(1);
        } else {
            throw new WireFormatException("Expected a map or a [kind, payload] array, got " + root.getNodeType());
        }

        if (kind == null || !kind.isTextual()) {
            throw new WireFormatException("Missing or non-string 'kind'");
        }
        return new WireMessage(kind.textValue(), payloadBytes(payload));
    }

    private static byte[] payloadBytes(JsonNode payload) throws WireFormatException {
        if (payload == null || payload.isNull()) {
            throw new WireFormatException("Missing 'payload'");
        }
        if (payload.isBinary()) {
            try {
                return payload.binaryValue();
            } catch (IOException e) {
                throw new WireFormatException("Unreadable 'payload'", e);
            }
        }
        if (payload.isArray()) {
            byte[] bytes = new byte[payload.size()];
            for (int i = 0; i < bytes.length; i++) {
                JsonNode b = payload.get(i);
                if (!b.canConvertToInt() || !b.isIntegralNumber() || b.intValue() < 0 || b.intValue() > 255) {
                    throw new WireFormatException("'payload' element " + i + " is not a byte");
                }
                bytes[i] = (byte) b.intValue();
            }
            return bytes;
        }
        throw new WireFormatException("'payload' must be binary, got " + payload.getNodeType());
    }
}
