package com.visionai.gateway.nats.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visionai.gateway.core.bus.ChannelDispatcher;
import com.visionai.gateway.core.bus.EventBusNotConnectedException;
import com.visionai.gateway.core.bus.MessageCodec;
import com.visionai.gateway.core.model.BusMessage;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.Subscription;
import io.nats.client.impl.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * NATS links are mocked; the connector seam hands out one mock connection per role.
 */
class NatsEventBusTransportTest {

    private final Connection publisher = mock(Connection.class);
    private final Connection subscriber = mock(Connection.class);
    private final Connection client = mock(Connection.class);
    private final Dispatcher wire = mock(Dispatcher.class);
    private final List<ConnectionListener> listeners = new ArrayList<>();
    private final ChannelDispatcher dispatcher = new ChannelDispatcher(Schedulers.boundedElastic());
    private final MessageCodec codec = new MessageCodec(new ObjectMapper());

    private NatsConnector connector;

    @BeforeEach
    void setUp() {
        for (Connection c : List.of(publisher, subscriber, client)) {
            when(c.getStatus()).thenReturn(Connection.Status.CONNECTED);
        }
        when(subscriber.createDispatcher()).thenReturn(wire);
        when(wire.subscribe(anyString(), any(MessageHandler.class))).thenAnswer(inv -> mock(Subscription.class));
        connector = (role, listener, errors) -> {
            listeners.add(listener);
            return switch (role) {
                case "publisher" -> publisher;
                case "subscriber" -> subscriber;
                default -> client;
            };
        };
    }

    @AfterEach
    void tearDown() {
        dispatcher.clear();
    }

    @Test
    void publishBeforeConnectShouldNotReachTheWire() {
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);

        StepVerifier.create(transport.publish("user.login", Map.of("userId", "u1")))
                .expectError(EventBusNotConnectedException.class)
                .verify();

        verify(publisher, never()).publish(anyString(), any(Headers.class), any(byte[].class));
    }

    @Test
    void connectShouldOpenThreeLinksAndReportReady() {
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);

        transport.connect().block();

        assertThat(listeners).hasSize(3);
        assertThat(transport.getConnectionStatus().connected()).isTrue();
        assertThat(transport.getConnectionStatus().publisherReady()).isTrue();
        assertThat(transport.getConnectionStatus().clientReady()).isTrue();
    }

    @Test
    void failedConnectShouldCloseOpenedLinks() throws Exception {
        NatsConnector failing = (role, listener, errors) -> {
            if (role.equals("client")) {
                throw new IOException("Unable to connect to NATS servers");
            }
            return role.equals("publisher") ? publisher : subscriber;
        };
        NatsEventBusTransport transport = new NatsEventBusTransport(failing, codec, dispatcher, false);

        StepVerifier.create(transport.connect()).expectError(IOException.class).verify();

        verify(publisher).close();
        verify(subscriber).close();
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void publishShouldSendJsonWithOriginHeader() {
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);
        transport.connect().block();

        transport.publish("user.login", Map.of("userId", "u1")).block();

        ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(publisher).publish(eq("user.login"), headers.capture(), body.capture());
        assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo("{\"userId\":\"u1\"}");
        assertThat(headers.getValue().getFirst(NatsEventBusTransport.ORIGIN_HEADER)).isNotBlank();
    }

    @Test
    void lostLinkShouldFlipReadinessUntilReconnected() {
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);
        transport.connect().block();

        listeners.get(0).connectionEvent(publisher, ConnectionListener.Events.DISCONNECTED);
        StepVerifier.create(transport.publish("user.login", Map.of()))
                .expectError(EventBusNotConnectedException.class)
                .verify();

        listeners.get(0).connectionEvent(publisher, ConnectionListener.Events.RECONNECTED);
        assertThat(transport.isConnected()).isTrue();
    }

    @Test
    void wireMessageShouldReachCallbackAndMalformedTextArrivesRaw() {
        Sinks.Many<BusMessage> received = Sinks.many().replay().all();
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);
        transport.connect().block();
        transport.subscribe("usage-guardian.check", msg -> {
            received.tryEmitNext(msg);
            return Mono.empty();
        }).block();

        transport.onWireMessage(wireMessage("usage-guardian.check", "{\"userId\":\"u1\"}", null));
        transport.onWireMessage(wireMessage("usage-guardian.check", "<<garbage>>", null));

        StepVerifier.create(received.asFlux())
                .assertNext(msg -> assertThat(msg.field("userId")).isEqualTo("u1"))
                .assertNext(msg -> assertThat(msg.raw()).isEqualTo("<<garbage>>"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void resubscribeShouldKeepOneWireSubscriptionAndUnsubscribeShouldRemoveIt() {
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);
        transport.connect().block();

        transport.subscribe("user.login", msg -> Mono.empty()).block();
        transport.subscribe("user.login", msg -> Mono.empty()).block();
        transport.unsubscribe("user.login").block();

        verify(wire, times(1)).subscribe(eq("user.login"), any(MessageHandler.class));
        verify(wire).unsubscribe(any(Subscription.class));
        assertThat(dispatcher.isBound("user.login")).isFalse();
    }

    @Test
    void failedWireSubscribeShouldLeaveNoLocalBinding() {
        when(wire.subscribe(eq("user.logout"), any(MessageHandler.class)))
                .thenThrow(new IllegalStateException("Dispatcher is closed"));
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, true);
        transport.connect().block();

        StepVerifier.create(transport.subscribe("user.logout", msg -> Mono.empty()))
                .expectErrorMessage("Dispatcher is closed")
                .verify();

        assertThat(dispatcher.isBound("user.logout")).isFalse();
        transport.publish("user.logout", Map.of("userId", "u1")).block();
        assertThat(dispatcher.channels()).doesNotContain("user.logout");
    }

    @Test
    void localDeliveryShouldDropTheWireEchoOfOwnMessages() {
        Sinks.Many<BusMessage> received = Sinks.many().replay().all();
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, true);
        transport.connect().block();
        transport.subscribe("user.login", msg -> {
            received.tryEmitNext(msg);
            return Mono.empty();
        }).block();

        transport.publish("user.login", Map.of("userId", "local")).block();
        ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
        verify(publisher).publish(eq("user.login"), headers.capture(), any(byte[].class));
        transport.onWireMessage(wireMessage("user.login", "{\"userId\":\"local\"}", headers.getValue()));
        transport.onWireMessage(wireMessage("user.login", "{\"userId\":\"remote\"}",
                new Headers().add(NatsEventBusTransport.ORIGIN_HEADER, "another-process")));

        StepVerifier.create(received.asFlux().take(2).map(msg -> msg.field("userId")))
                .expectNext("local", "remote")
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void disconnectShouldCloseEveryLinkAndToleratePartialState() throws Exception {
        NatsEventBusTransport transport = new NatsEventBusTransport(connector, codec, dispatcher, false);
        StepVerifier.create(transport.disconnect()).verifyComplete();

        transport.connect().block();
        transport.disconnect().block();

        verify(subscriber).closeDispatcher(wire);
        verify(publisher).close();
        verify(client).close();
        assertThat(transport.getConnectionStatus().connected()).isFalse();
    }

    private static Message wireMessage(String subject, String text, Headers headers) {
        Message msg = mock(Message.class);
        when(msg.getSubject()).thenReturn(subject);
        when(msg.getData()).thenReturn(text.getBytes(StandardCharsets.UTF_8));
        when(msg.getHeaders()).thenReturn(headers);
        return msg;
    }
}
