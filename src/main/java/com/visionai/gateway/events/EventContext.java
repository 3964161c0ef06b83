package com.visionai.gateway.events;

import com.visionai.gateway.core.model.PublishResult;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Capabilities the event manager lends to its handlers.
 */
public interface EventContext {

    /** Publishes {@code data} with a fresh {@code timestamp} and {@code eventId}. Never errors. */
    Mono<PublishResult> publish(String channel, Map<String, Object> data);

    /** Current health document: status, timestamp, eventBus, channels, databases. */
    Map<String, Object> healthSnapshot();

    /** Starts the graceful shutdown without tying it to the caller's subscription. */
    Mono<Void> requestShutdown();
}
