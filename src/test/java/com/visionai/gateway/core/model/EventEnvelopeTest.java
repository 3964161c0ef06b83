package com.visionai.gateway.core.model;

import com.visionai.gateway.core.id.EventIdGenerator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class EventEnvelopeTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
    private final EventIdGenerator ids = new EventIdGenerator(() -> 1714558530000L, new Random(3));

    @Test
    void shouldInjectTimestampAndEventIdOverCallerFields() {
        Map<String, Object> data = new HashMap<>();
        data.put("userId", "u1");
        data.put("timestamp", "stale");
        data.put("eventId", "event_0_old");

        Map<String, Object> wire = EventEnvelope.wrap(data, clock, ids).toWire();

        assertThat(wire).contains(entry("userId", "u1"), entry("timestamp", "2024-05-01T10:15:30.000Z"));
        assertThat((String) wire.get("eventId")).startsWith("event_1714558530000_");
    }

    @Test
    void shouldNotExposeCallerMapMutations() {
        Map<String, Object> data = new HashMap<>();
        data.put("k", 1);
        EventEnvelope envelope = EventEnvelope.wrap(data, clock, ids);

        data.put("k", 2);

        assertThat(envelope.payload()).containsEntry("k", 1);
    }

    @Test
    void nullPayloadShouldWrapAsEmpty() {
        EventEnvelope envelope = EventEnvelope.wrap(null, clock, ids);

        assertThat(envelope.toWire()).containsOnlyKeys("timestamp", "eventId");
    }

    @Test
    void busMessagePayloadShouldDropInjectedFields() {
        BusMessage message = BusMessage.structured("c", "{}",
                Map.of("userId", "u1", "timestamp", "t", "eventId", "e"));

        assertThat(message.payload()).containsOnly(entry("userId", "u1"));
    }

    @Test
    void unstructuredMessageShouldForwardAsRaw() {
        BusMessage message = BusMessage.unparsed("c", "not json");

        assertThat(message.isStructured()).isFalse();
        assertThat(message.field("anything")).isNull();
        assertThat(message.payload()).containsOnly(entry("raw", "not json"));
    }
}
