package com.visionai.gateway.database.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Optional single primary connection with automatic reconnection.
 * Only wired when {@code agentgw.primary-database.uri} is set.
 */
@Validated
@ConfigurationProperties(prefix = "agentgw.primary-database")
public class PrimaryDatabaseProperties {

    private String uri;

    private String name = "agentgw";

    /** Attempts after the first failure, both at startup and after a lost connection. */
    @Min(0)
    private int maxRetries = 5;

    /** Attempt n waits {@code baseDelay * n}. */
    @NotNull
    private Duration baseDelay = Duration.ofSeconds(5);

    public DatabaseTarget toTarget() {
        return new DatabaseTarget(uri, name);
    }

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBaseDelay() { return baseDelay; }
    public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
}
