package com.phillippitts.realtimesync.service.channel;

import com.phillippitts.realtimesync.domain.ChangeEvent;
import com.phillippitts.realtimesync.domain.EventType;
import com.phillippitts.realtimesync.exception.ChangePayloadException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Map;

/**
 * Parses raw change payloads delivered by a channel provider into {@link ChangeEvent}s.
 *
 * <p>Expected shape:
 * <pre>{@code
 * {"eventType": "INSERT", "schema": "public", "table": "conversations",
 *  "new": {"id": 7, "body": "hi"}, "old": {}}
 * }</pre>
 *
 * <p>{@code new} and {@code old} may be missing or {@code null}. {@code POLL_UPDATE} is never
 * accepted from the wire.
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> Payloads larger than {@link #MAX_PAYLOAD_SIZE} are rejected before
 * parsing.
 *
 * @since 1.0
 */
public final class ChangePayloadParser {

    /** Maximum accepted payload size (1MB). */
    static final int MAX_PAYLOAD_SIZE = 1_048_576;

    private ChangePayloadParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one raw payload.
     *
     * @param json raw JSON text from the provider
     * @return the parsed change event
     * @throws ChangePayloadException if the payload is empty, oversized, not JSON, or lacks a
     *         required field
     */
    public static ChangeEvent parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ChangePayloadException("empty payload");
        }
        if (json.length() > MAX_PAYLOAD_SIZE) {
            throw new ChangePayloadException("payload of " + json.length()
                    + " chars exceeds " + MAX_PAYLOAD_SIZE + " char cap");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new ChangePayloadException("not a JSON object", e);
        }

        EventType type = parseEventType(obj.optString("eventType", null));
        String schema = requireText(obj, "schema");
        String table = requireText(obj, "table");

        return new ChangeEvent(type, schema, table, row(obj, "new"), row(obj, "old"));
    }

    private static EventType parseEventType(String raw) {
        EventType type;
        try {
            type = EventType.fromWire(raw);
        } catch (IllegalArgumentException e) {
            throw new ChangePayloadException("unknown eventType '" + raw + "'", e);
        }
        if (type == EventType.POLL_UPDATE) {
            throw new ChangePayloadException("POLL_UPDATE is not a wire event");
        }
        return type;
    }

    private static String requireText(JSONObject obj, String key) {
        String value = obj.optString(key, "").trim();
        if (value.isEmpty()) {
            throw new ChangePayloadException("missing '" + key + "'");
        }
        return value;
    }

    private static Map<String, Object> row(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        JSONObject row = obj.optJSONObject(key);
        if (row == null) {
            throw new ChangePayloadException("'" + key + "' is not an object");
        }
        return row.toMap();
    }
}
