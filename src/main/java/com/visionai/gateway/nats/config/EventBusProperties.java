package com.visionai.gateway.nats.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Event bus backend settings.
 *
 * <h2>Binding</h2>
 * Bound from the prefix {@code agentgw.event-bus}, e.g.:
 * <pre>
 * agentgw:
 *   event-bus:
 *     transport: nats          # nats | in-memory
 *     host: localhost
 *     port: 4222
 *     password: ${EVENT_BUS_PASSWORD:}
 *     local-delivery: false
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>{@code password} is sent as a NATS token, or as the password of {@code user} when a user is set.
 *       Treat it as a secret: never log it.</li>
 *   <li>{@code in-memory} runs the whole choreography inside one process; nothing reaches a server.</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "agentgw.event-bus")
public class EventBusProperties {

    /** Which transport implementation to build: {@code nats} or {@code in-memory}. */
    @NotBlank
    private String transport = "nats";

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 4222;

    /** Optional user for user/password auth. */
    private String user;

    /** Optional token, or the password of {@link #user}. */
    private String password;

    /** Prefix of the NATS connection names; the role is appended. */
    @NotBlank
    private String connectionName = "agent-gateway";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration reconnectWait = Duration.ofMillis(100);

    /** -1 retries forever. */
    private int maxReconnects = -1;

    /**
     * Hand publishes straight to same-process listeners (and drop their wire echo).
     *
     * <p><b>Default</b>: {@code false}, every delivery comes from the wire.</p>
     */
    private boolean localDelivery = false;

    public String serverUrl() {
        return "nats://" + host + ":" + port;
    }

    public String getTransport() { return transport; }
    public void setTransport(String transport) { this.transport = transport; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReconnectWait() { return reconnectWait; }
    public void setReconnectWait(Duration reconnectWait) { this.reconnectWait = reconnectWait; }

    public int getMaxReconnects() { return maxReconnects; }
    public void setMaxReconnects(int maxReconnects) { this.maxReconnects = maxReconnects; }

    public boolean isLocalDelivery() { return localDelivery; }
    public void setLocalDelivery(boolean localDelivery) { this.localDelivery = localDelivery; }
}
