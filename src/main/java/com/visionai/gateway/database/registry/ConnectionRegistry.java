package com.visionai.gateway.database.registry;

import com.visionai.gateway.core.model.CleanupOutcome;
import com.visionai.gateway.database.config.DatabaseTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * =====================================================================================================
 * ConnectionRegistry
 * =====================================================================================================
 *
 * PURPOSE
 * -------
 * Owns at most one database handle per logical service name (strategy, assets, usage, eventStore, ...).
 *
 * REUSE RULE
 * ----------
 * {@link #connect} returns the existing handle when it is {@link ReadyState#CONNECTED}. Anything else
 * (no entry, disconnected, still connecting) opens a fresh handle and replaces the entry. Because opening
 * suspends, the entry is re-checked when the fresh handle arrives: if a concurrent caller registered a
 * connected handle in the meantime, that one wins and the fresh handle is closed again.
 *
 * FAILURE MODEL
 * -------------
 * - connect: the connector's error propagates; nothing is registered.
 * - connectAll: fail-fast on the first error. The other connects keep running and register themselves.
 * - disconnect / disconnectAll: never fail; each service reports a {@link CleanupOutcome}.
 */
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final DatabaseConnector connector;
    private final Map<String, DatabaseHandle> handles = new ConcurrentHashMap<>();
    private final Map<String, Disposable> observers = new ConcurrentHashMap<>();

    public ConnectionRegistry(DatabaseConnector connector) {
        this.connector = connector;
    }

    /**
     * Returns a connected handle for {@code serviceName}, reusing the registered one when it is connected.
     */
    public Mono<DatabaseHandle> connect(String serviceName, DatabaseTarget target) {
        return Mono.defer(() -> {
            DatabaseHandle existing = handles.get(serviceName);
            if (existing != null && existing.readyState() == ReadyState.CONNECTED) {
                log.info("Reusing existing database connection service={}", serviceName);
                return Mono.just(existing);
            }
            log.info("Connecting database service={} database={}", serviceName, target.getName());
            return connector.connect(serviceName, target)
                    .flatMap(fresh -> register(serviceName, fresh))
                    .doOnError(err -> log.error("Database connection failed service={}: {}",
                            serviceName, err.toString()));
        });
    }

    /**
     * Connects every target concurrently. Completes once all are connected, or errors with the first
     * failure without waiting for the rest.
     */
    public Mono<Void> connectAll(Map<String, DatabaseTarget> targets) {
        return Mono.defer(() -> {
            log.info("Connecting {} database(s): {}", targets.size(), targets.keySet());
            // toFuture() starts each connect now and keeps it running if the batch fails fast
            List<CompletableFuture<DatabaseHandle>> running = new ArrayList<>(targets.size());
            targets.forEach((service, target) -> running.add(connect(service, target).toFuture()));
            return Flux.fromIterable(running)
                    .flatMap(future -> Mono.fromFuture(future, true))
                    .then()
                    .doOnSuccess(ignored -> log.info("All databases connected: {}", targets.keySet()));
        });
    }

    /**
     * @throws ConnectionNotFoundException when nothing is registered under {@code serviceName}
     */
    public DatabaseHandle get(String serviceName) {
        DatabaseHandle handle = handles.get(serviceName);
        if (handle == null) {
            throw new ConnectionNotFoundException(serviceName);
        }
        return handle;
    }

    /**
     * Closes and removes one handle. Unknown names are a no-op; close errors are logged and reported.
     */
    public Mono<CleanupOutcome> disconnect(String serviceName) {
        return Mono.defer(() -> {
            DatabaseHandle handle = handles.get(serviceName);
            if (handle == null) {
                return Mono.just(CleanupOutcome.ok(serviceName, "disconnect"));
            }
            return handle.close()
                    .then(Mono.fromCallable(() -> {
                        handles.remove(serviceName, handle);
                        stopObserving(serviceName);
                        log.info("Disconnected database service={}", serviceName);
                        return CleanupOutcome.ok(serviceName, "disconnect");
                    }))
                    .onErrorResume(err -> {
                        log.error("Error disconnecting database service={}: {}", serviceName, err.toString());
                        return Mono.just(CleanupOutcome.failed(serviceName, "disconnect", err));
                    });
        });
    }

    /** Disconnects every registered service concurrently. */
    public Mono<List<CleanupOutcome>> disconnectAll() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(handles.keySet())))
                .flatMap(this::disconnect)
                .collectList()
                .doOnNext(outcomes -> log.info("Closed {} database connection(s)", outcomes.size()));
    }

    /** Service name to ready-state label, sorted by service name. */
    public Map<String, String> status() {
        Map<String, String> status = new TreeMap<>();
        handles.forEach((service, handle) -> status.put(service, handle.readyState().label()));
        return status;
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }

    private Mono<DatabaseHandle> register(String serviceName, DatabaseHandle fresh) {
        AtomicReference<DatabaseHandle> replaced = new AtomicReference<>();
        DatabaseHandle winner = handles.compute(serviceName, (key, current) -> {
            if (current != null && current != fresh && current.readyState() == ReadyState.CONNECTED) {
                return current;
            }
            if (current != null && current != fresh) {
                replaced.set(current);
            }
            return fresh;
        });

        if (winner != fresh) {
            log.info("Concurrent connect already registered service={}, closing duplicate", serviceName);
            return fresh.close()
                    .onErrorResume(err -> {
                        log.warn("Error closing duplicate connection service={}: {}", serviceName, err.toString());
                        return Mono.empty();
                    })
                    .thenReturn(winner);
        }

        observe(serviceName, fresh);
        log.info("Connected database service={} database={}", serviceName, fresh.databaseName());

        DatabaseHandle stale = replaced.get();
        if (stale == null) {
            return Mono.just(fresh);
        }
        return stale.close()
                .onErrorResume(err -> {
                    log.warn("Error closing stale connection service={}: {}", serviceName, err.toString());
                    return Mono.empty();
                })
                .thenReturn(fresh);
    }

    private void observe(String serviceName, DatabaseHandle handle) {
        Disposable subscription = handle.stateChanges()
                .skip(1)
                .subscribe(
                        state -> {
                            switch (state) {
                                case DISCONNECTED -> log.warn("Database disconnected service={}", serviceName);
                                case CONNECTED -> log.info("Database reconnected service={} retries={}",
                                        serviceName, handle.retryCount());
                                default -> log.debug("Database service={} state={}", serviceName, state.label());
                            }
                        },
                        err -> log.error("Database error service={}: {}", serviceName, err.toString()));
        Disposable previous = observers.put(serviceName, subscription);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void stopObserving(String serviceName) {
        Disposable subscription = observers.remove(serviceName);
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
