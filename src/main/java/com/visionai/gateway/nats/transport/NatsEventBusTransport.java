package com.visionai.gateway.nats.transport;

import com.visionai.gateway.core.bus.ChannelDispatcher;
import com.visionai.gateway.core.bus.EventBusNotConnectedException;
import com.visionai.gateway.core.bus.EventBusTransport;
import com.visionai.gateway.core.bus.EventCallback;
import com.visionai.gateway.core.bus.MessageCodec;
import com.visionai.gateway.core.bus.TransportStatus;
import com.visionai.gateway.core.channel.Channels;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Consumer;
import io.nats.client.Dispatcher;
import io.nats.client.ErrorListener;
import io.nats.client.Message;
import io.nats.client.Subscription;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Event bus transport over NATS core pub/sub.
 *
 * <h2>Links</h2>
 * Three connections to the same server, one per role:
 * <ul>
 *   <li>{@code publisher}: outbound messages.</li>
 *   <li>{@code subscriber}: owns the NATS {@link Dispatcher} carrying every channel subscription.</li>
 *   <li>{@code client}: auxiliary link, reported in status and available for probes.</li>
 * </ul>
 *
 * <h2>Ready flag</h2>
 * Set once {@link #connect()} has opened all links, then driven by NATS connection events: any
 * disconnect/close clears it, a reconnect sets it again when every link is back to {@code CONNECTED}.
 *
 * <h2>Local delivery</h2>
 * With {@code localDelivery} enabled a publish is also handed straight to the same-process listener. Every
 * outbound message carries an origin header; the wire echo of this process's own messages is then dropped,
 * so a listener sees each message once. With it disabled (default) all deliveries come from the wire.
 *
 * <h2>Threading</h2>
 * Connect/disconnect are blocking network calls and run on {@link Schedulers#boundedElastic()}. Inbound
 * messages arrive on the NATS dispatcher thread and are only queued there; callbacks run on the
 * {@link ChannelDispatcher} scheduler.
 */
public class NatsEventBusTransport implements EventBusTransport {

    private static final Logger log = LoggerFactory.getLogger(NatsEventBusTransport.class);

    static final String ORIGIN_HEADER = "Agentgw-Origin";

    private final NatsConnector connector;
    private final MessageCodec codec;
    private final ChannelDispatcher dispatcher;
    private final boolean localDelivery;
    private final String originId = UUID.randomUUID().toString();

    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final AtomicBoolean linked = new AtomicBoolean(false);
    private final Map<String, Subscription> wireSubscriptions = new ConcurrentHashMap<>();

    private volatile Connection publisher;
    private volatile Connection subscriber;
    private volatile Connection client;
    private volatile Dispatcher natsDispatcher;

    public NatsEventBusTransport(NatsConnector connector, MessageCodec codec, ChannelDispatcher dispatcher,
                                 boolean localDelivery) {
        this.connector = connector;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.localDelivery = localDelivery;
    }

    @Override
    public Mono<Void> connect() {
        return Mono.fromCallable(() -> {
                    ConnectionListener listener = this::onConnectionEvent;
                    ErrorListener errors = new LoggingErrorListener();
                    try {
                        publisher = connector.open("publisher", listener, errors);
                        subscriber = connector.open("subscriber", listener, errors);
                        client = connector.open("client", listener, errors);
                        natsDispatcher = subscriber.createDispatcher();
                    } catch (Exception e) {
                        log.error("Event bus connection failed: {}", e.toString());
                        closeQuietly();
                        throw e;
                    }
                    linked.set(true);
                    ready.set(true);
                    log.info("Event bus (NATS) connected (localDelivery={})", localDelivery);
                    return Boolean.TRUE;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> publish(String channel, Object data) {
        return Mono.fromRunnable(() -> {
                    Channels.requireValid(channel);
                    Connection out = publisher;
                    if (!ready.get() || out == null) {
                        throw new EventBusNotConnectedException("publish", channel);
                    }
                    String text = codec.encode(data);
                    Headers headers = new Headers().add(ORIGIN_HEADER, originId);
                    out.publish(channel, headers, text.getBytes(StandardCharsets.UTF_8));
                    if (localDelivery) {
                        dispatcher.deliver(codec.decode(channel, text));
                    }
                    log.debug("Published to channel={} bytes={}", channel, text.length());
                })
                // publish may block while the outgoing buffer is full
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> subscribe(String channel, EventCallback callback) {
        return Mono.fromRunnable(() -> {
            Channels.requireValid(channel);
            Dispatcher wire = natsDispatcher;
            if (!ready.get() || wire == null) {
                throw new EventBusNotConnectedException("subscribe", channel);
            }
            // bound first so nothing arriving right after the wire subscribe is dropped
            dispatcher.bind(channel, callback);
            try {
                wireSubscriptions.computeIfAbsent(channel, subject -> wire.subscribe(subject, this::onWireMessage));
            } catch (RuntimeException e) {
                dispatcher.unbind(channel);
                throw e;
            }
            log.info("Subscribed to channel={}", channel);
        });
    }

    @Override
    public Mono<Void> unsubscribe(String channel) {
        return Mono.fromRunnable(() -> {
            Dispatcher wire = natsDispatcher;
            Subscription subscription = wireSubscriptions.remove(channel);
            if (subscription != null && wire != null) {
                // unsubscribe(String) only covers subscriptions made without a handler
                wire.unsubscribe(subscription);
            }
            dispatcher.unbind(channel);
            log.info("Unsubscribed from channel={}", channel);
        });
    }

    @Override
    public Mono<Void> disconnect() {
        return Mono.fromCallable(() -> {
                    linked.set(false);
                    ready.set(false);
                    Exception failure = closeQuietly();
                    dispatcher.clear();
                    wireSubscriptions.clear();
                    if (failure != null) {
                        throw failure;
                    }
                    log.info("Event bus (NATS) disconnected");
                    return Boolean.TRUE;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public TransportStatus getConnectionStatus() {
        return new TransportStatus(ready.get(), isUp(publisher), isUp(subscriber), isUp(client));
    }

    void onWireMessage(Message msg) {
        if (localDelivery && isOwnMessage(msg)) {
            return;
        }
        byte[] data = msg.getData();
        String text = data == null ? "" : new String(data, StandardCharsets.UTF_8);
        dispatcher.deliver(codec.decode(msg.getSubject(), text));
    }

    private boolean isOwnMessage(Message msg) {
        Headers headers = msg.getHeaders();
        return headers != null && originId.equals(headers.getFirst(ORIGIN_HEADER));
    }

    private void onConnectionEvent(Connection conn, ConnectionListener.Events type) {
        switch (type) {
            case DISCONNECTED, CLOSED -> {
                if (linked.get()) {
                    log.warn("Event bus link {} ({})", type, conn.getOptions() == null ? "?" : conn.getOptions().getConnectionName());
                }
                ready.set(false);
            }
            case CONNECTED, RECONNECTED, RESUBSCRIBED -> {
                boolean allUp = linked.get() && isUp(publisher) && isUp(subscriber) && isUp(client);
                ready.set(allUp);
                if (type == ConnectionListener.Events.RECONNECTED) {
                    log.info("Event bus link reconnected (ready={})", allUp);
                }
            }
            default -> log.debug("Event bus connection event {}", type);
        }
    }

    /** Closes whatever was opened; returns the first failure instead of throwing. */
    private Exception closeQuietly() {
        Exception first = null;
        Dispatcher wire = natsDispatcher;
        natsDispatcher = null;
        if (wire != null && subscriber != null) {
            try {
                subscriber.closeDispatcher(wire);
            } catch (Exception e) {
                first = e;
                log.warn("Closing NATS dispatcher failed: {}", e.toString());
            }
        }
        Connection[] links = {publisher, subscriber, client};
        String[] roles = {"publisher", "subscriber", "client"};
        for (int i = 0; i < links.length; i++) {
            if (links[i] == null) {
                continue;
            }
            try {
                links[i].close();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                first = first == null ? ie : first;
            } catch (Exception e) {
                first = first == null ? e : first;
                log.warn("Closing NATS {} link failed: {}", roles[i], e.toString());
            }
        }
        publisher = null;
        subscriber = null;
        client = null;
        return first;
    }

    private static boolean isUp(Connection c) {
        return c != null && c.getStatus() == Connection.Status.CONNECTED;
    }

    private static final class LoggingErrorListener implements ErrorListener {

        @Override
        public void errorOccurred(Connection conn, String error) {
            log.error("NATS error: {}", error);
        }

        @Override
        public void exceptionOccurred(Connection conn, Exception exp) {
            log.error("NATS exception: {}", exp.toString(), exp);
        }

        @Override
        public void slowConsumerDetected(Connection conn, Consumer consumer) {
            log.warn("NATS slow consumer detected, pending={}", consumer.getPendingMessageCount());
        }
    }
}
