package com.visionai.gateway.events;

import com.visionai.gateway.core.model.BusMessage;
import reactor.core.publisher.Mono;

/**
 * Reaction to one inbound channel message. Handlers hold no bus reference; everything they may do goes
 * through the {@link EventContext}, so they can be exercised without a transport.
 */
@FunctionalInterface
public interface EventHandler {

    Mono<Void> handle(BusMessage message, EventContext context);
}
