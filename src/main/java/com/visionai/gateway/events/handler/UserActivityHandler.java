package com.visionai.gateway.events.handler;

import com.visionai.gateway.core.channel.Channels;
import com.visionai.gateway.core.model.BusMessage;
import com.visionai.gateway.events.EventContext;
import com.visionai.gateway.events.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code user.login} / {@code user.logout}: emits an {@code analytics.user-activity} record. The activity
 * time is the envelope's injected {@code timestamp}.
 */
public final class UserActivityHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(UserActivityHandler.class);

    private final String action;

    public UserActivityHandler(String action) {
        this.action = action;
    }

    @Override
    public Mono<Void> handle(BusMessage message, EventContext context) {
        Object userId = message.field("userId");
        log.info("User {} event userId={}", action, userId);

        Map<String, Object> activity = new LinkedHashMap<>();
        Payloads.putIfPresent(activity, "userId", userId);
        activity.put("action", action);
        return context.publish(Channels.ANALYTICS_USER_ACTIVITY, activity).then();
    }
}
