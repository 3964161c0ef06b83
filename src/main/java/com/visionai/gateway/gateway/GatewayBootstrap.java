package com.visionai.gateway.gateway;

import com.visionai.gateway.core.model.CleanupOutcome;
import com.visionai.gateway.database.config.DatabaseProperties;
import com.visionai.gateway.database.config.DatabaseTarget;
import com.visionai.gateway.database.registry.ConnectionRegistry;
import com.visionai.gateway.database.single.PrimaryDatabaseConnection;
import com.visionai.gateway.events.EventManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * GatewayBootstrap
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Brings the gateway up and down in a fixed order.
 *
 * STARTUP (after all singletons exist, before the HTTP server starts)
 * -------
 *   1. validate database configuration
 *   2. connect every configured database (fail fast), skipping blank optional ones
 *   3. connect the primary database, if configured
 *   4. initialize the event manager (transport connect + subscriptions)
 *
 * Any failure aborts context startup.
 *
 * SHUTDOWN (after the HTTP server stopped accepting)
 * --------
 *   1. event manager graceful shutdown
 *   2. disconnect every registry database
 *   3. disconnect the primary database
 *
 * Each step is best effort; the whole sequence is bounded by
 * {@code agentgw.gateway.shutdown-timeout}.
 */
@Component
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayBootstrap implements SmartInitializingSingleton, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(GatewayBootstrap.class);

    private final DatabaseProperties databaseProps;
    private final GatewayProperties gatewayProps;
    private final ConnectionRegistry registry;
    private final EventManager eventManager;
    private final ObjectProvider<PrimaryDatabaseConnection> primary;

    public GatewayBootstrap(DatabaseProperties databaseProps,
                            GatewayProperties gatewayProps,
                            ConnectionRegistry registry,
                            EventManager eventManager,
                            ObjectProvider<PrimaryDatabaseConnection> primary) {
        this.databaseProps = databaseProps;
        this.gatewayProps = gatewayProps;
        this.registry = registry;
        this.eventManager = eventManager;
        this.primary = primary;
    }

    @Override
    public void afterSingletonsInstantiated() {
        start().block(gatewayProps.getStartupTimeout());
    }

    @Override
    public void destroy() {
        try {
            shutdown().block(gatewayProps.getShutdownTimeout());
        } catch (RuntimeException e) {
            log.error("Gateway shutdown did not finish within {}: {}", gatewayProps.getShutdownTimeout(), e.toString());
        }
    }

    Mono<Void> start() {
        return Mono.defer(() -> {
            databaseProps.requireComplete();
            Map<String, DatabaseTarget> services = databaseProps.completeServices();
            log.info("Gateway starting services={}", services.keySet());
            PrimaryDatabaseConnection primaryConnection = primary.getIfAvailable();
            Mono<Void> primaryStart = primaryConnection == null
                    ? Mono.empty()
                    : primaryConnection.initialize().then();
            return registry.connectAll(services)
                    .then(primaryStart)
                    .then(Mono.defer(eventManager::initialize))
                    .doOnNext(outcomes -> log.info("Gateway started channels={} databases={}",
                            eventManager.getStatus().channelCount(), registry.status()))
                    .then();
        }).doOnError(err -> log.error("Gateway startup failed: {}", err.toString()));
    }

    /**
     * Runs every shutdown step and returns all outcomes. Never errors.
     */
    Mono<List<CleanupOutcome>> shutdown() {
        log.info("Gateway shutting down");
        PrimaryDatabaseConnection primaryConnection = primary.getIfAvailable();
        Mono<List<CleanupOutcome>> primaryStop = primaryConnection == null
                ? Mono.just(List.of())
                : primaryConnection.disconnect().map(List::of);

        return eventManager.gracefulShutdown()
                .flatMap(events -> registry.disconnectAll().map(databases -> concat(events, databases)))
                .flatMap(steps -> primaryStop.map(last -> concat(steps, last)))
                .doOnNext(outcomes -> {
                    long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
                    if (failed > 0) {
                        log.warn("Gateway shutdown finished with {} failed step(s): {}", failed, outcomes);
                    } else {
                        log.info("Gateway shutdown complete steps={}", outcomes.size());
                    }
                });
    }

    private static List<CleanupOutcome> concat(List<CleanupOutcome> first, List<CleanupOutcome> second) {
        List<CleanupOutcome> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
