package com.visionai.gateway.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A message as delivered to a subscriber callback.
 *
 * <p>{@code value} is whatever the wire text parsed to: a {@link Map} for a JSON object, a {@link List}
 * for an array, a {@link String}, {@link Number} or {@link Boolean} for a scalar, {@code null} for JSON
 * {@code null}. When the text is not JSON at all, {@code parsed} is false and only {@code raw} is
 * available (best-effort delivery).</p>
 */
public record BusMessage(String channel, String raw, boolean parsed, Object value) {

    public BusMessage {
        Objects.requireNonNull(channel, "channel");
        raw = raw == null ? "" : raw;
        value = parsed ? readOnly(value) : null;
    }

    public static BusMessage structured(String channel, String raw, Map<String, Object> fields) {
        return new BusMessage(channel, raw, true, Objects.requireNonNull(fields, "fields"));
    }

    public static BusMessage parsed(String channel, String raw, Object value) {
        return new BusMessage(channel, raw, true, value);
    }

    public static BusMessage unparsed(String channel, String raw) {
        return new BusMessage(channel, raw, false, null);
    }

    /** True when the payload is a JSON object. */
    public boolean isStructured() {
        return value instanceof Map;
    }

    /** The decoded JSON object, or {@code null} for any other payload. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> fields() {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /** Field value, or {@code null} when absent or the payload is not an object. */
    public Object field(String name) {
        Map<String, Object> fields = fields();
        return fields == null ? null : fields.get(name);
    }

    /**
     * Payload without the injected {@code timestamp}/{@code eventId}, so a forward gets fresh ones.
     * A non-object JSON value forwards as {@code {value: <value>}}, unparsed text as {@code {raw: <text>}}.
     */
    public Map<String, Object> payload() {
        Map<String, Object> fields = fields();
        if (fields != null) {
            Map<String, Object> copy = new LinkedHashMap<>(fields);
            copy.remove(EventEnvelope.TIMESTAMP);
            copy.remove(EventEnvelope.EVENT_ID);
            return copy;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        if (parsed) {
            wrapped.put("value", value);
        } else {
            wrapped.put("raw", raw);
        }
        return wrapped;
    }

    private static Object readOnly(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        return value;
    }
}
