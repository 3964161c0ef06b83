package com.visionai.gateway.nats.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visionai.gateway.core.bus.ChannelDispatcher;
import com.visionai.gateway.core.bus.EventBusTransport;
import com.visionai.gateway.core.bus.MessageCodec;
import com.visionai.gateway.inmemory.InMemoryEventBusTransport;
import com.visionai.gateway.nats.transport.NatsConnector;
import com.visionai.gateway.nats.transport.NatsEventBusTransport;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

/**
 * Spring configuration that wires up the event bus transport.
 *
 * <h2>Beans</h2>
 * <ul>
 *   <li>{@link MessageCodec}: JSON text encoding over the application {@link ObjectMapper}.</li>
 *   <li>{@link ChannelDispatcher}: local listener lanes, draining on {@code boundedElastic}.</li>
 *   <li>{@link EventBusTransport}: NATS by default, in-memory with
 *       {@code agentgw.event-bus.transport=in-memory}.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * The transport bean is created disconnected. Links are opened by the gateway bootstrap through
 * {@code EventManager.initialize()}, not here, so a bus outage surfaces as a startup failure with context
 * instead of a bean creation error.
 */
@Configuration
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusConfig {

    private static final Logger log = LoggerFactory.getLogger(EventBusConfig.class);

    @Bean
    public MessageCodec messageCodec(ObjectMapper mapper) {
        return new MessageCodec(mapper);
    }

    @Bean
    public ChannelDispatcher channelDispatcher() {
        return new ChannelDispatcher(Schedulers.boundedElastic());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentgw.event-bus", name = "transport", havingValue = "nats", matchIfMissing = true)
    public NatsConnector natsConnector(EventBusProperties props) {
        return (role, connectionListener, errorListener) -> {
            Options.Builder builder = new Options.Builder()
                    .server(props.serverUrl())
                    .connectionName(props.getConnectionName() + "-" + role)
                    .connectionTimeout(props.getConnectTimeout())
                    .reconnectWait(props.getReconnectWait())
                    .maxReconnects(props.getMaxReconnects())
                    .connectionListener(connectionListener)
                    .errorListener(errorListener);

            boolean hasUser = props.getUser() != null && !props.getUser().isBlank();
            boolean hasPassword = props.getPassword() != null && !props.getPassword().isBlank();
            if (hasUser) {
                builder.userInfo(props.getUser().toCharArray(),
                        hasPassword ? props.getPassword().toCharArray() : new char[0]);
            } else if (hasPassword) {
                builder.token(props.getPassword().toCharArray());
            }

            log.info("Connecting to NATS (url={}, role={}, user={}, auth={})",
                    props.serverUrl(), role, hasUser ? mask(props.getUser()) : "", hasUser || hasPassword);
            return Nats.connect(builder.build());
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentgw.event-bus", name = "transport", havingValue = "nats", matchIfMissing = true)
    public EventBusTransport natsEventBusTransport(NatsConnector connector, MessageCodec codec,
                                                   ChannelDispatcher dispatcher, EventBusProperties props) {
        return new NatsEventBusTransport(connector, codec, dispatcher, props.isLocalDelivery());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentgw.event-bus", name = "transport", havingValue = "in-memory")
    public EventBusTransport inMemoryEventBusTransport(MessageCodec codec, ChannelDispatcher dispatcher) {
        return new InMemoryEventBusTransport(codec, dispatcher);
    }

    /**
     * Masks an identifier for logging. Example: "admin" -> "a***n".
     */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
