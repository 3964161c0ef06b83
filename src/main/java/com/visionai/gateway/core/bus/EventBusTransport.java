package com.visionai.gateway.core.bus;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * EventBusTransport
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for the pub/sub channel abstraction the
 * event manager is built on.
 *
 *   [ EventManager ]
 *          │
 *          ▼
 *   [ EventBusTransport ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ NATS / in-process ]
 *
 * It knows NOTHING about the choreography, envelopes or handler
 * bookkeeping; it moves text between channels and callbacks.
 *
 * READINESS
 * ---------
 * {@link #publish} and {@link #subscribe} fail with
 * {@link EventBusNotConnectedException} until {@link #connect()} has
 * succeeded, and again whenever the backend reports the link lost.
 *
 * DELIVERY
 * --------
 * - Inbound text is decoded as a JSON object; anything else is delivered
 *   raw instead of failing (best-effort delivery).
 * - Callbacks run asynchronously, never on the publisher's call stack.
 * - Order is preserved per channel, not across channels.
 * - A failing callback is logged at the dispatch boundary and does not
 *   affect other deliveries.
 *
 * SUBSCRIPTIONS
 * -------------
 * One callback per channel: subscribing again replaces the previous
 * callback.
 *
 * THREAD SAFETY
 * -------------
 * Implementations are process-wide singletons and MUST be internally
 * thread-safe.
 */
public interface EventBusTransport {

    /**
     * Establishes the publish, subscribe and auxiliary links and sets the ready flag.
     * Errors with the underlying connection failure.
     */
    Mono<Void> connect();

    /**
     * Sends {@code data} on {@code channel}. Strings are sent as-is, anything else is JSON encoded.
     */
    Mono<Void> publish(String channel, Object data);

    /**
     * Registers the backend subscription for {@code channel} and binds {@code callback} to it.
     */
    Mono<Void> subscribe(String channel, EventCallback callback);

    /**
     * Removes the backend subscription and every local callback for {@code channel}.
     */
    Mono<Void> unsubscribe(String channel);

    /**
     * Closes all links. Safe on a transport that never connected or connected partially.
     */
    Mono<Void> disconnect();

    /** Readiness of each logical role. Never throws. */
    TransportStatus getConnectionStatus();

    default boolean isConnected() {
        return getConnectionStatus().connected();
    }
}
