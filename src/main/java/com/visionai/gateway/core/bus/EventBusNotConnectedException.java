package com.visionai.gateway.core.bus;

/**
 * Raised by a transport operation attempted while the transport is not ready.
 */
public class EventBusNotConnectedException extends IllegalStateException {

    public EventBusNotConnectedException(String operation, String channel) {
        super("Event bus not connected (" + operation + " " + channel + ")");
    }
}
