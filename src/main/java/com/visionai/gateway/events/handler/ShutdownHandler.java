package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@code system.shutdown}: tears the event manager down. The shutdown unsubscribes this very channel, so it
 * runs detached from the dispatch lane that delivered the request.
 */
public final class ShutdownHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHandler.class);

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        log.warn("System shutdown requested data={}", message.payload());
        return context.requestShutdown();
    }
}
