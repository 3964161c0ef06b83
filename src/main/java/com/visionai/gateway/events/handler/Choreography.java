package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.channel.AgentType;
import com.visionai.gateway.core.channel.Channels;
import com.visionai.gateway.events.EventHandler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The gateway's inbound bindings: channel to handler, in subscription order.
 *
 * <pre>
 *   &lt;agent&gt;.request              → internal.&lt;agent&gt;.process   (payload unchanged)
 *   &lt;agent&gt;.completed            → usage-guardian.update-usage
 *   &lt;agent&gt;.error                → system.agent-error
 *   usage-guardian.check           → internal.usage-guardian.check
 *   usage-guardian.limit-exceeded  → system.usage-limit-exceeded (+ security log)
 *   usage-guardian.usage-updated   → log only
 *   system.health-check            → system.health-status
 *   system.shutdown                → graceful shutdown
 *   user.login / user.logout       → analytics.user-activity
 *   user.subscription-changed      → usage-guardian.subscription-updated
 * </pre>
 */
public final class Choreography {

    private Choreography() {
    }

    public static Map<String, EventHandler> defaultBindings() {
        Map<String, EventHandler> bindings = new LinkedHashMap<>();

        for (AgentType agent : AgentType.values()) {
            bindings.put(agent.requestChannel(),
                    new ForwardingHandler(agent.channelPrefix(), "request", agent.processChannel()));
            bindings.put(agent.completedChannel(), new AgentCompletedHandler(agent));
            bindings.put(agent.errorChannel(), new AgentErrorHandler(agent));
        }

        bindings.put(Channels.USAGE_CHECK,
                new ForwardingHandler("usage-guardian", "check", Channels.INTERNAL_USAGE_CHECK));
        bindings.put(Channels.USAGE_LIMIT_EXCEEDED, new UsageLimitExceededHandler());
        bindings.put(Channels.USAGE_UPDATED, new LogOnlyHandler("usage-guardian", "usage-updated"));

        bindings.put(Channels.SYSTEM_HEALTH_CHECK, new HealthCheckHandler());
        bindings.put(Channels.SYSTEM_SHUTDOWN, new ShutdownHandler());

        bindings.put(Channels.USER_LOGIN, new UserActivityHandler("login"));
        bindings.put(Channels.USER_LOGOUT, new UserActivityHandler("logout"));
        bindings.put(Channels.USER_SUBSCRIPTION_CHANGED,
                new ForwardingHandler("user", "subscription-changed", Channels.USAGE_SUBSCRIPTION_UPDATED));

        return Collections.unmodifiableMap(bindings);
    }
}
