package com.visionai.gateway.gateway;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "agentgw.gateway")
public class GatewayProperties {

    /** Upper bound for connecting databases and the event bus at startup. */
    @NotNull
    private Duration startupTimeout = Duration.ofMinutes(2);

    /** Upper bound for the whole shutdown sequence. */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public Duration getStartupTimeout() { return startupTimeout; }
    public void setStartupTimeout(Duration startupTimeout) { this.startupTimeout = startupTimeout; }

    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
}
