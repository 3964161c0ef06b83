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
 * {@code <agent>.completed}: turns the agent's result into a usage update for the usage guardian.
 *
 * <p>Published fields: {@code userId}, {@code agentType}, {@code action} and the agent's metric. A metric
 * that is absent, zero, {@code false} or empty is reported as {@code 0}.</p>
 */
public final class AgentCompletedHandler implements EventHandler {

    private final AgentType agent;

    public AgentCompletedHandler(AgentType agent) {
        this.agent = agent;
    }

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        ActivityLog.agent(agent.channelPrefix(), "completed", message.payload());

        Map<String, Object> usage = new LinkedHashMap<>();
        Payloads.putIfPresent(usage, "userId", message.field("userId"));
        usage.put("agentType", agent.channelPrefix());
        usage.put("action", agent.usageAction());
        usage.put(agent.metricField(), Payloads.orZero(message.field(agent.metricField())));
        return context.publish(Channels.USAGE_UPDATE, usage).then();
    }
}
