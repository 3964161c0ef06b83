package com.visionai.gateway.gateway;

import com.visionai.gateway.core.bus.EventBusTransport;
import com.visionai.gateway.core.model.HealthStatus;
import com.visionai.gateway.database.registry.ConnectionRegistry;
import com.visionai.gateway.database.single.PrimaryDatabaseConnection;
import com.visionai.gateway.events.EventManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the composite health document from the registry, the transport, the event manager and, when
 * present, the primary connection.
 */
@Service
public class GatewayHealthService {

    private final ConnectionRegistry registry;
    private final EventBusTransport transport;
    private final EventManager eventManager;
    private final ObjectProvider<PrimaryDatabaseConnection> primary;
    private final Clock clock;

    public GatewayHealthService(ConnectionRegistry registry,
                                EventBusTransport transport,
                                EventManager eventManager,
                                ObjectProvider<PrimaryDatabaseConnection> primary,
                                Clock clock) {
        this.registry = registry;
        this.transport = transport;
        this.eventManager = eventManager;
        this.primary = primary;
        this.clock = clock;
    }

    public Mono<HealthDocument> health() {
        Map<String, String> databases = registry.status();
        PrimaryDatabaseConnection primaryConnection = primary.getIfAvailable();

        List<String> states = new ArrayList<>(databases.values());
        if (primaryConnection != null) {
            states.add(primaryConnection.getStatus().readyState());
        }
        HealthStatus status = HealthStatus.reduce(transport.isConnected(), eventManager.isInitialized(), states);

        Mono<HealthDocument> document = Mono.just(new HealthDocument(status.label(), databases,
                transport.getConnectionStatus(), null, clock.instant().truncatedTo(ChronoUnit.MILLIS)));
        if (primaryConnection == null) {
            return document;
        }
        return document.zipWith(primaryConnection.healthCheck(), (doc, report) -> new HealthDocument(
                doc.status(), doc.databases(), doc.eventBus(), report, doc.timestamp()));
    }
}
