package com.visionai.gateway.database.registry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A live binding to one logical database, keyed by service name.
 *
 * <p>Handles are owned by whoever opened them (the {@link ConnectionRegistry} or the single primary
 * connection). Other code holds non-owning references and must not use a handle after it was closed.</p>
 */
public interface DatabaseHandle {

    String serviceName();

    String uri();

    String databaseName();

    ReadyState readyState();

    /** Times the backend re-established the connection after losing it. */
    int retryCount();

    /**
     * State transitions as they happen. Replays the current state to new subscribers and completes when
     * the handle is closed.
     */
    Flux<ReadyState> stateChanges();

    /** Lightweight round trip against the live connection. */
    Mono<Void> ping();

    /** Closes the underlying connection. */
    Mono<Void> close();
}
