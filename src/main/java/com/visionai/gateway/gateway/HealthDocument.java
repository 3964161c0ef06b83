package com.visionai.gateway.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.visionai.gateway.core.bus.TransportStatus;
import com.visionai.gateway.core.model.HealthStatus;
import com.visionai.gateway.database.single.HealthReport;

import java.time.Instant;
import java.util.Map;

/**
 * Composite health served on {@code GET /health}.
 *
 * @param primaryDatabase omitted when no primary connection is configured
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthDocument(String status,
                             Map<String, String> databases,
                             TransportStatus eventBus,
                             HealthReport primaryDatabase,
                             Instant timestamp) {

    public boolean isHealthy() {
        return HealthStatus.HEALTHY.label().equals(status);
    }
}
