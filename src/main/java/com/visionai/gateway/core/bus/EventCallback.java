package com.visionai.gateway.core.bus;

import com.visionai.gateway.core.model.BusMessage;
import reactor.core.publisher.Mono;

/**
 * Receives messages for one channel. The returned {@link Mono} is awaited before the next message of the
 * same channel is delivered.
 */
@FunctionalInterface
public interface EventCallback {

    Mono<Void> onMessage(BusMessage message);
}
