package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.channel.Channels;
import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.ActivityLog;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Records the breach on the security log and escalates it on {@code system.usage-limit-exceeded}.
 */
public final class UsageLimitExceededHandler implements EventHandler {

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        Map<String, Object> payload = message.payload();
        ActivityLog.security("usage-limit-exceeded", payload);
        return context.publish(Channels.SYSTEM_USAGE_LIMIT_EXCEEDED, payload).then();
    }
}
