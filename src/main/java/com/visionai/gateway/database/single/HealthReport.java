package com.visionai.gateway.database.single;

import java.util.Map;

/**
 * Result of {@link PrimaryDatabaseConnection#healthCheck()}.
 *
 * @param status  {@code connected}, {@code disconnected}, {@code failed} or {@code error}
 * @param healthy true only for a connected link that answered a ping
 * @param details free-form diagnostics (database, ready state, error message)
 */
public record HealthReport(String status, boolean healthy, Map<String, Object> details) {

    public HealthReport {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
