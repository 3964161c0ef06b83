package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.ActivityLog;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import reactor.core.publisher.Mono;

public final class LogOnlyHandler implements EventHandler {

    private final String agent;
    private final String activity;

    public LogOnlyHandler(String agent, String activity) {
        this.agent = agent;
        this.activity = activity;
    }

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        ActivityLog.agent(agent, activity, message.payload());
        return Mono.empty();
    }
}
