package com.visionai.gateway.core.channel;

import java.util.regex.Pattern;

/**
 * Channel names used by the choreography, plus the validation rule applied to every channel name that
 * reaches a transport.
 *
 * <h2>Format</h2>
 * Dot separated tokens, each starting with an alphanumeric and containing only alphanumerics, {@code _}
 * and {@code -}, e.g. {@code usage-guardian.limit-exceeded}. Wildcards ({@code *}, {@code >}) are
 * rejected: every binding is to one concrete channel.
 */
public final class Channels {

    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");

    private static final int MAX_TOKENS = 8;

    public static final String USAGE_CHECK = "usage-guardian.check";
    public static final String USAGE_LIMIT_EXCEEDED = "usage-guardian.limit-exceeded";
    public static final String USAGE_UPDATED = "usage-guardian.usage-updated";
    public static final String USAGE_UPDATE = "usage-guardian.update-usage";
    public static final String USAGE_SUBSCRIPTION_UPDATED = "usage-guardian.subscription-updated";
    public static final String INTERNAL_USAGE_CHECK = "internal.usage-guardian.check";

    public static final String SYSTEM_HEALTH_CHECK = "system.health-check";
    public static final String SYSTEM_HEALTH_STATUS = "system.health-status";
    public static final String SYSTEM_SHUTDOWN = "system.shutdown";
    public static final String SYSTEM_AGENT_ERROR = "system.agent-error";
    public static final String SYSTEM_USAGE_LIMIT_EXCEEDED = "system.usage-limit-exceeded";

    public static final String USER_LOGIN = "user.login";
    public static final String USER_LOGOUT = "user.logout";
    public static final String USER_SUBSCRIPTION_CHANGED = "user.subscription-changed";

    public static final String ANALYTICS_USER_ACTIVITY = "analytics.user-activity";

    private Channels() {}

    /**
     * Returns {@code channel} unchanged if it is a valid concrete channel name.
     *
     * @throws IllegalArgumentException when null, blank, wildcarded or malformed
     */
    public static String requireValid(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        String[] tokens = channel.split("\\.", -1);
        if (tokens.length > MAX_TOKENS) {
            throw new IllegalArgumentException("channel has more than " + MAX_TOKENS + " tokens: " + channel);
        }
        for (String token : tokens) {
            if (!TOKEN.matcher(token).matches()) {
                throw new IllegalArgumentException("invalid channel token '" + token + "' in: " + channel);
            }
        }
        return channel;
    }
}
