package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.ActivityLog;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Re-publishes the inbound payload unchanged (minus the injected envelope fields) on {@code target}.
 */
public final class ForwardingHandler implements EventHandler {

    private final String agent;
    private final String activity;
    private final String target;

    public ForwardingHandler(String agent, String activity, String target) {
        this.agent = agent;
        this.activity = activity;
        this.target = target;
    }

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        Map<String, Object> payload = message.payload();
        ActivityLog.agent(agent, activity, payload);
        return context.publish(target, payload).then();
    }
}
