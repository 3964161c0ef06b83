package com.visionai.gateway.events;

import com.visionai.gateway.core.bus.EventBusTransport;
import com.visionai.gateway.core.id.EventIdGenerator;
import com.visionai.gateway.database.registry.ConnectionRegistry;
import com.visionai.gateway.events.handler.Choreography;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EventManagerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventIdGenerator eventIdGenerator() {
        return new EventIdGenerator();
    }

    @Bean
    public EventManager eventManager(EventBusTransport transport, EventIdGenerator ids, Clock clock,
                                     ConnectionRegistry registry) {
        return new EventManager(transport, Choreography.defaultBindings(), ids, clock, registry::status);
    }
}
