package com.visionai.gateway.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Dedicated log categories, routable on their own in logback.
 */
public final class ActivityLog {

    private static final Logger AGENT = LoggerFactory.getLogger("agentgw.agent-activity");
    private static final Logger SECURITY = LoggerFactory.getLogger("agentgw.security");

    private ActivityLog() {
    }

    public static void agent(String agent, String action, Map<String, Object> data) {
        AGENT.info("agent={} action={} data={}", agent, action, data);
    }

    public static void security(String event, Map<String, Object> data) {
        SECURITY.warn("event={} data={}", event, data);
    }
}
