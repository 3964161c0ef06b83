package com.visionai.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Agent gateway: event choreography for the AI agents plus per-service database connections.
 *
 * <p>Mongo clients are created per service by the connection registry, so Boot's single-client
 * auto-configuration is switched off.</p>
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
