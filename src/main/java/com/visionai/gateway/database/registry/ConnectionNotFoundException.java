package com.visionai.gateway.database.registry;

import java.util.NoSuchElementException;

/**
 * No handle is registered under the requested service name.
 */
public class ConnectionNotFoundException extends NoSuchElementException {

    private final String serviceName;

    public ConnectionNotFoundException(String serviceName) {
        super("Database connection for " + serviceName + " not found");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
