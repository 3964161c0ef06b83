package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.channel.Channels;
import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Answers {@code system.health-check} with the current health document on {@code system.health-status}.
 */
public final class HealthCheckHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        log.info("System health check requested data={}", message.payload());
        return Mono.fromCallable(context::healthSnapshot)
                .flatMap(snapshot -> context.publish(Channels.SYSTEM_HEALTH_STATUS, snapshot))
                .then();
    }
}
