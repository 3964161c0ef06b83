package com.visionai.gateway.database.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-tenant database settings: one {@link DatabaseTarget} per logical service plus the connection
 * limits shared by all of them.
 *
 * <h2>Binding</h2>
 * <pre>
 * agentgw:
 *   database:
 *     connect-timeout: 5s
 *     socket-timeout: 45s
 *     max-pool-size: 10
 *     services:
 *       strategy:   { uri: ${STRATEGY_DB_URI},    name: ${STRATEGY_DB_NAME} }
 *       assets:     { uri: ${ASSETS_DB_URI},      name: ${ASSETS_DB_NAME} }
 *       usage:      { uri: ${USAGE_DB_URI},       name: ${USAGE_DB_NAME} }
 *       eventStore: { uri: ${EVENT_STORE_DB_URI}, name: ${EVENT_STORE_DB_NAME} }
 * </pre>
 *
 * Every name in {@code required-services} must have a complete target; {@link #requireComplete()} is
 * checked before any connection is attempted.
 */
@Validated
@ConfigurationProperties(prefix = "agentgw.database")
public class DatabaseProperties {

    /** Bounds connection establishment (server selection and socket connect). */
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Sockets idle longer than this are closed. */
    @NotNull
    private Duration socketTimeout = Duration.ofSeconds(45);

    @Min(1)
    @Max(500)
    private int maxPoolSize = 10;

    private List<String> requiredServices = new ArrayList<>(List.of("strategy", "assets", "usage", "eventStore"));

    private Map<String, DatabaseTarget> services = new LinkedHashMap<>();

    /**
     * Fails when a required service is missing or has a blank uri/name.
     *
     * @throws IllegalStateException listing every missing key
     */
    public void requireComplete() {
        List<String> missing = new ArrayList<>();
        for (String service : requiredServices) {
            DatabaseTarget target = services.get(service);
            if (target == null) {
                missing.add("agentgw.database.services." + service);
                continue;
            }
            if (target.getUri() == null || target.getUri().isBlank()) {
                missing.add("agentgw.database.services." + service + ".uri");
            }
            if (target.getName() == null || target.getName().isBlank()) {
                missing.add("agentgw.database.services." + service + ".name");
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required database configuration: " + missing);
        }
    }

    /**
     * Services with both uri and name set, in declaration order. Optional services left blank are skipped.
     */
    public Map<String, DatabaseTarget> completeServices() {
        Map<String, DatabaseTarget> complete = new LinkedHashMap<>();
        services.forEach((service, target) -> {
            if (target != null && target.isComplete()) {
                complete.put(service, target);
            }
        });
        return complete;
    }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getSocketTimeout() { return socketTimeout; }
    public void setSocketTimeout(Duration socketTimeout) { this.socketTimeout = socketTimeout; }

    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

    public List<String> getRequiredServices() { return requiredServices; }
    public void setRequiredServices(List<String> requiredServices) { this.requiredServices = requiredServices; }

    public Map<String, DatabaseTarget> getServices() { return services; }
    public void setServices(Map<String, DatabaseTarget> services) { this.services = services; }
}
