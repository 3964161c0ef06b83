package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.channel.AgentType;
import com.visionai.gateway.core.channel.Channels;
import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.ActivityLog;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code <agent>.error}: reports the failure on {@code system.agent-error}.
 */
public final class AgentErrorHandler implements EventHandler {

    private final AgentType agent;

    public AgentErrorHandler(AgentType agent) {
        this.agent = agent;
    }

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        ActivityLog.agent(agent.channelPrefix(), "error", message.payload());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("agent", agent.channelPrefix());
        Payloads.putIfPresent(report, "error", message.field("error"));
        Payloads.putIfPresent(report, "userId", message.field("userId"));
        return context.publish(Channels.SYSTEM_AGENT_ERROR, report).then();
    }
}
