package com.visionai.gateway.core.model;

import java.util.Collection;
import java.util.Locale;

/**
 * Composite health of the gateway.
 */
public enum HealthStatus {

    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Reduces component states to one status.
     *
     * <ul>
     *   <li>bus down or event manager not initialized: {@code UNHEALTHY}</li>
     *   <li>databases registered but none {@code connected}: {@code UNHEALTHY}</li>
     *   <li>some database not {@code connected}: {@code DEGRADED}</li>
     *   <li>otherwise {@code HEALTHY}</li>
     * </ul>
     *
     * @param databaseStates ready-state labels, one per database
     */
    public static HealthStatus reduce(boolean busConnected, boolean managerInitialized,
                                      Collection<String> databaseStates) {
        if (!busConnected || !managerInitialized) {
            return UNHEALTHY;
        }
        long connected = databaseStates.stream().filter("connected"::equals).count();
        if (!databaseStates.isEmpty() && connected == 0) {
            return UNHEALTHY;
        }
        return connected == databaseStates.size() ? HEALTHY : DEGRADED;
    }
}
