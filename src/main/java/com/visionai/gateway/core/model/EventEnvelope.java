package com.visionai.gateway.core.model;

import com.visionai.gateway.core.id.EventIdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * =====================================================================
 * EventEnvelope
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The unit published on the event bus: arbitrary payload fields plus the two
 * system-injected fields {@code timestamp} and {@code eventId}.
 *
 * IMMUTABILITY
 * ------------
 * The payload is copied on construction and exposed read-only. Consumers never
 * see this instance; they receive a copy decoded from the wire text.
 *
 * FIELD PRECEDENCE
 * ----------------
 * When the payload already carries {@code timestamp} or {@code eventId}
 * (e.g. a forwarded event), the injected values win in {@link #toWire()}.
 */
public record EventEnvelope(

        /** Opaque identifier, unique per publish call. */
        String eventId,

        /** Publish time, millisecond precision. */
        Instant timestamp,

        /** Caller supplied fields, without the injected ones. */
        Map<String, Object> payload) {

    public static final String TIMESTAMP = "timestamp";
    public static final String EVENT_ID = "eventId";

    /** Always three fraction digits, {@code Instant.toString()} drops them on whole seconds. */
    public static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public EventEnvelope {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Stamps {@code data} with a fresh event id and the current time of {@code clock}.
     */
    public static EventEnvelope wrap(Map<String, Object> data, Clock clock, EventIdGenerator ids) {
        return new EventEnvelope(ids.next(), clock.instant().truncatedTo(ChronoUnit.MILLIS), data);
    }

    /**
     * Flat map sent on the wire: payload fields first, then {@code timestamp} (ISO-8601) and {@code eventId}.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>(payload);
        wire.put(TIMESTAMP, ISO_MILLIS.format(timestamp));
        wire.put(EVENT_ID, eventId);
        return wire;
    }
}
