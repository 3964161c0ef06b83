package com.visionai.gateway.core.channel;

/**
 * =====================================================================
 * AgentType
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The agents sitting behind the gateway that follow the
 * request / completed / error channel convention:
 *
 *   <agent>.request     inbound work
 *   <agent>.completed   agent finished, usage must be recorded
 *   <agent>.error       agent failed
 *
 * Each agent also names the usage {@code action} reported to the usage
 * guardian and the payload field carrying its consumption metric.
 *
 * The usage guardian itself is not listed: it uses its own channels
 * (check / limit-exceeded / usage-updated).
 */
public enum AgentType {

    BUSINESS_STRATEGY("business-strategy", "generate-strategy", "tokensUsed"),

    ASSET_CURATOR("asset-curator", "curate-assets", "assetsRetrieved");

    private final String channelPrefix;
    private final String usageAction;
    private final String metricField;

    AgentType(String channelPrefix, String usageAction, String metricField) {
        this.channelPrefix = channelPrefix;
        this.usageAction = usageAction;
        this.metricField = metricField;
    }

    /** Channel token, also used as {@code agentType} in usage updates. */
    public String channelPrefix() {
        return channelPrefix;
    }

    public String usageAction() {
        return usageAction;
    }

    public String metricField() {
        return metricField;
    }

    public String requestChannel() {
        return channelPrefix + ".request";
    }

    public String completedChannel() {
        return channelPrefix + ".completed";
    }

    public String errorChannel() {
        return channelPrefix + ".error";
    }

    /** Internal hand-off channel the agent service listens on. */
    public String processChannel() {
        return "internal." + channelPrefix + ".process";
    }
}
