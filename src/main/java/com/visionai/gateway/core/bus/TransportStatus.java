package com.visionai.gateway.core.bus;

/**
 * Readiness per logical transport role.
 *
 * @param connected       the transport-level ready flag
 * @param publisherReady  link used for publishing
 * @param subscriberReady link carrying subscriptions
 * @param clientReady     auxiliary link (health probes)
 */
public record TransportStatus(boolean connected, boolean publisherReady, boolean subscriberReady, boolean clientReady) {

    public static TransportStatus down() {
        return new TransportStatus(false, false, false, false);
    }
}
