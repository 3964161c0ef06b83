package com.visionai.gateway.events;

import com.visionai.gateway.core.bus.EventBusTransport;
import com.visionai.gateway.core.id.EventIdGenerator;
import com.visionai.gateway.core.model.CleanupOutcome;
import com.visionai.gateway.core.model.EventEnvelope;
import com.visionai.gateway.core.model.HealthStatus;
import com.visionai.gateway.core.model.PublishResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * =====================================================================
 * EventManager
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Binds the gateway's choreography onto the event bus and owns the
 * envelope contract: every message published through here carries a
 * fresh {@code timestamp} and {@code eventId}.
 *
 * LIFECYCLE
 * ---------
 *   initialize()        connect transport (fatal), subscribe every binding
 *                       (best effort), then mark initialized
 *   gracefulShutdown()  unsubscribe every channel, disconnect transport;
 *                       runs once, later calls share the first run
 *
 * FAILURE MODEL
 * -------------
 * Only the transport connect in {@link #initialize()} can fail the
 * caller. Subscribe, publish, unsubscribe and disconnect failures are
 * logged and returned as outcomes.
 */
public class EventManager implements EventContext {

    private static final Logger log = LoggerFactory.getLogger(EventManager.class);

    private final EventBusTransport transport;
    private final Map<String, EventHandler> bindings;
    private final EventIdGenerator ids;
    private final Clock clock;
    private final Supplier<Map<String, String>> databaseStatus;

    private final Map<String, EventHandler> channels = new ConcurrentHashMap<>();
    private final AtomicReference<Mono<List<CleanupOutcome>>> shutdown = new AtomicReference<>();
    private volatile boolean initialized;

    public EventManager(EventBusTransport transport,
                        Map<String, EventHandler> bindings,
                        EventIdGenerator ids,
                        Clock clock,
                        Supplier<Map<String, String>> databaseStatus) {
        this.transport = transport;
        this.bindings = bindings;
        this.ids = ids;
        this.clock = clock;
        this.databaseStatus = databaseStatus;
    }

    /**
     * Connects the transport and subscribes every binding.
     *
     * @return one outcome per binding; errors only when the transport cannot connect
     */
    public Mono<List<CleanupOutcome>> initialize() {
        return transport.connect()
                .doOnError(err -> log.error("Event manager initialization failed: {}", err.toString()))
                .thenMany(Flux.fromIterable(bindings.entrySet())
                        .concatMap(binding -> subscribe(binding.getKey(), binding.getValue())))
                .collectList()
                .doOnNext(outcomes -> {
                    initialized = true;
                    long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
                    log.info("Event manager initialized channels={} failedSubscriptions={}",
                            channels.size(), failed);
                });
    }

    /**
     * Binds {@code handler} to {@code channel}, replacing any previous handler.
     */
    public Mono<CleanupOutcome> subscribe(String channel, EventHandler handler) {
        return Mono.defer(() -> transport.subscribe(channel, message -> handler.handle(message, this)))
                .then(Mono.fromCallable(() -> {
                    channels.put(channel, handler);
                    log.info("Subscribed to channel={}", channel);
                    return CleanupOutcome.ok(channel, "subscribe");
                }))
                .onErrorResume(err -> {
                    log.error("Subscribing to channel={} failed: {}", channel, err.toString());
                    return Mono.just(CleanupOutcome.failed(channel, "subscribe", err));
                });
    }

    @Override
    public Mono<PublishResult> publish(String channel, Map<String, Object> data) {
        return Mono.defer(() -> {
            EventEnvelope envelope = EventEnvelope.wrap(data, clock, ids);
            return transport.publish(channel, envelope.toWire())
                    .then(Mono.fromCallable(() -> {
                        log.info("Published event channel={} eventId={}", channel, envelope.eventId());
                        log.debug("Published payload channel={} data={}", channel, envelope.payload());
                        return PublishResult.ok(channel, envelope.eventId());
                    }))
                    .onErrorResume(err -> {
                        log.error("Publishing to channel={} eventId={} failed: {}",
                                channel, envelope.eventId(), err.toString());
                        return Mono.just(PublishResult.failed(channel, envelope.eventId(), err));
                    });
        }).onErrorResume(err -> {
            log.error("Publishing to channel={} failed: {}", channel, err.toString());
            return Mono.just(PublishResult.failed(channel, null, err));
        });
    }

    @Override
    public Map<String, Object> healthSnapshot() {
        Map<String, String> databases = databaseStatus.get();
        HealthStatus status = HealthStatus.reduce(transport.isConnected(), initialized, databases.values());

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", status.label());
        snapshot.put("timestamp", EventEnvelope.ISO_MILLIS.format(clock.instant()));
        snapshot.put("eventBus", transport.getConnectionStatus());
        snapshot.put("channels", channelNames());
        snapshot.put("databases", databases);
        return snapshot;
    }

    @Override
    public Mono<Void> requestShutdown() {
        gracefulShutdown().subscribe(
                outcomes -> log.info("Shutdown requested over the bus completed steps={}", outcomes.size()),
                err -> log.error("Shutdown requested over the bus failed: {}", err.toString()));
        return Mono.empty();
    }

    public ManagerStatus getStatus() {
        List<String> names = channelNames();
        return new ManagerStatus(initialized, names.size(), names, transport.getConnectionStatus());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Unsubscribes every channel (continuing past failures) and disconnects the transport.
     * Never errors; returns one outcome per step.
     */
    public Mono<List<CleanupOutcome>> gracefulShutdown() {
        Mono<List<CleanupOutcome>> run = Mono.defer(this::shutdownSteps).cache();
        if (!shutdown.compareAndSet(null, run)) {
            return shutdown.get();
        }
        return run;
    }

    private Mono<List<CleanupOutcome>> shutdownSteps() {
        log.info("Starting event manager shutdown channels={}", channels.size());
        initialized = false;
        return Flux.fromIterable(channelNames())
                .concatMap(this::unsubscribe)
                .concatWith(transport.disconnect()
                        .thenReturn(CleanupOutcome.ok("event-bus", "disconnect"))
                        .onErrorResume(err -> {
                            log.error("Disconnecting event bus failed: {}", err.toString());
                            return Mono.just(CleanupOutcome.failed("event-bus", "disconnect", err));
                        }))
                .collectList()
                .doOnNext(outcomes -> log.info("Event manager shutdown completed failedSteps={}",
                        outcomes.stream().filter(o -> !o.succeeded()).count()));
    }

    private Mono<CleanupOutcome> unsubscribe(String channel) {
        return Mono.defer(() -> transport.unsubscribe(channel))
                .then(Mono.fromCallable(() -> {
                    channels.remove(channel);
                    log.debug("Unsubscribed from channel={}", channel);
                    return CleanupOutcome.ok(channel, "unsubscribe");
                }))
                .onErrorResume(err -> {
                    log.error("Unsubscribing from channel={} failed: {}", channel, err.toString());
                    return Mono.just(CleanupOutcome.failed(channel, "unsubscribe", err));
                });
    }

    private List<String> channelNames() {
        List<String> names = new ArrayList<>();
        for (String channel : bindings.keySet()) {
            if (channels.containsKey(channel)) {
                names.add(channel);
            }
        }
        for (String channel : channels.keySet()) {
            if (!bindings.containsKey(channel)) {
                names.add(channel);
            }
        }
        return names;
    }
}
