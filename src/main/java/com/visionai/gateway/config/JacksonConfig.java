package com.visionai.gateway.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tunes the {@code ObjectMapper} Spring Boot builds, which the HTTP layer and the event bus codec share.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li>{@link JavaTimeModule}: {@code Instant} fields of health documents.</li>
 *   <li>{@code WRITE_DATES_AS_TIMESTAMPS = false}: ISO-8601 text, same shape as the envelope timestamp.</li>
 *   <li>unknown properties are ignored: bus payloads are open-ended.</li>
 * </ul>
 *
 * Everything else stays on Boot's defaults and {@code spring.jackson.*}.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer gatewayJacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
