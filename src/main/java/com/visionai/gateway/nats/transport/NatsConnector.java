package com.visionai.gateway.nats.transport;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ErrorListener;

import java.io.IOException;

/**
 * Opens one NATS connection for a transport role ({@code publisher}, {@code subscriber}, {@code client}).
 *
 * <p>Kept separate from the transport so connection options live in configuration and tests can supply
 * mocked connections.</p>
 */
@FunctionalInterface
public interface NatsConnector {

    Connection open(String role, ConnectionListener connectionListener, ErrorListener errorListener)
            throws IOException, InterruptedException;
}
