package com.visionai.gateway.inmemory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visionai.gateway.core.bus.ChannelDispatcher;
import com.visionai.gateway.core.bus.EventBusNotConnectedException;
import com.visionai.gateway.core.bus.MessageCodec;
import com.visionai.gateway.core.model.BusMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventBusTransportTest {

    private InMemoryEventBusTransport transport;

    @BeforeEach
    void setUp() {
        transport = new InMemoryEventBusTransport(new MessageCodec(new ObjectMapper()),
                new ChannelDispatcher(Schedulers.boundedElastic()));
    }

    @AfterEach
    void tearDown() {
        transport.disconnect().block();
    }

    @Test
    void publishBeforeConnectShouldFailWithNotConnected() {
        StepVerifier.create(transport.publish("user.login", Map.of("userId", "u1")))
                .expectErrorSatisfies(err -> assertThat(err)
                        .isInstanceOf(EventBusNotConnectedException.class)
                        .hasMessageContaining("user.login"))
                .verify();
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void subscribeBeforeConnectShouldFailWithNotConnected() {
        StepVerifier.create(transport.subscribe("user.login", msg -> Mono.empty()))
                .expectError(EventBusNotConnectedException.class)
                .verify();
    }

    @Test
    void shouldRoundTripStructuredPayload() {
        Sinks.Many<BusMessage> received = Sinks.many().replay().all();
        transport.connect().block();
        transport.subscribe("analytics.user-activity", msg -> {
            received.tryEmitNext(msg);
            return Mono.empty();
        }).block();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", "u1");
        payload.put("nested", Map.of("depth", 2));
        payload.put("list", List.of(1, 2, 3));
        payload.put("flag", true);
        transport.publish("analytics.user-activity", payload).block();

        StepVerifier.create(received.asFlux())
                .assertNext(msg -> assertThat(msg.fields()).isEqualTo(payload))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldRoundTripArrayAndScalarPayloads() {
        Sinks.Many<BusMessage> received = Sinks.many().replay().all();
        transport.connect().block();
        transport.subscribe("usage-guardian.usage-updated", msg -> {
            received.tryEmitNext(msg);
            return Mono.empty();
        }).block();

        transport.publish("usage-guardian.usage-updated", List.of(1, 2, 3)).block();
        transport.publish("usage-guardian.usage-updated", 42).block();

        StepVerifier.create(received.asFlux())
                .assertNext(msg -> {
                    assertThat(msg.parsed()).isTrue();
                    assertThat(msg.value()).isEqualTo(List.of(1, 2, 3));
                    assertThat(msg.payload()).containsEntry("value", List.of(1, 2, 3));
                })
                .assertNext(msg -> assertThat(msg.value()).isEqualTo(42))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void resubscribingShouldLeaveOnlyTheLatestCallback() {
        Sinks.Many<String> calls = Sinks.many().replay().all();
        transport.connect().block();
        transport.subscribe("user.logout", msg -> {
            calls.tryEmitNext("h1");
            return Mono.empty();
        }).block();
        transport.subscribe("user.logout", msg -> {
            calls.tryEmitNext("h2");
            return Mono.empty();
        }).block();

        transport.publish("user.logout", Map.of("userId", "u1")).block();
        transport.publish("user.logout", Map.of("userId", "u2")).block();

        StepVerifier.create(calls.asFlux().take(2))
                .expectNext("h2", "h2")
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void malformedTextShouldReachCallbackRawWithoutAffectingOtherChannels() {
        Sinks.Many<BusMessage> raw = Sinks.many().replay().all();
        Sinks.Many<BusMessage> other = Sinks.many().replay().all();
        transport.connect().block();
        transport.subscribe("usage-guardian.check", msg -> {
            raw.tryEmitNext(msg);
            return Mono.empty();
        }).block();
        transport.subscribe("user.login", msg -> {
            other.tryEmitNext(msg);
            return Mono.empty();
        }).block();

        transport.publish("usage-guardian.check", "{broken json").block();
        transport.publish("user.login", Map.of("userId", "u9")).block();

        StepVerifier.create(raw.asFlux())
                .assertNext(msg -> {
                    assertThat(msg.parsed()).isFalse();
                    assertThat(msg.raw()).isEqualTo("{broken json");
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(other.asFlux())
                .assertNext(msg -> assertThat(msg.field("userId")).isEqualTo("u9"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void unsubscribeShouldStopDelivery() {
        transport.connect().block();
        transport.subscribe("user.login", msg -> Mono.empty()).block();

        transport.unsubscribe("user.login").block();

        StepVerifier.create(transport.publish("user.login", Map.of())).verifyComplete();
        assertThat(transport.getConnectionStatus().connected()).isTrue();
    }
}
