package com.visionai.gateway.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.connection.ServerDescription;
import com.mongodb.event.ClusterClosedEvent;
import com.mongodb.event.ClusterDescriptionChangedEvent;
import com.mongodb.event.ClusterListener;
import com.visionai.gateway.database.registry.DatabaseHandle;
import com.visionai.gateway.database.registry.ReadyState;
import org.bson.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MongoDB handle backed by one sync {@link MongoClient}.
 *
 * <p>The handle is registered as the client's {@link ClusterListener}, so driver heartbeats drive
 * {@link #readyState()}: any reachable server means connected, none means disconnected (or still
 * connecting before the first successful contact).</p>
 *
 * <p>State changes are recorded under the handle's monitor but emitted after it is released, one thread
 * at a time and in transition order. Subscribers may therefore call back into {@link #readyState()} or take
 * their own locks without blocking the driver's cluster thread.</p>
 */
public final class MongoDatabaseHandle implements DatabaseHandle, ClusterListener {

    private final String serviceName;
    private final String uri;
    private final String databaseName;
    private final Sinks.Many<ReadyState> states = Sinks.many().replay().latest();
    private final Queue<ReadyState> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger emitting = new AtomicInteger();
    private volatile boolean completeRequested;

    private volatile MongoClient client;
    private ReadyState state = ReadyState.CONNECTING;
    private boolean everConnected;
    private int retryCount;
    private boolean closed;

    MongoDatabaseHandle(String serviceName, String uri, String databaseName) {
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName");
        states.tryEmitNext(ReadyState.CONNECTING);
    }

    void attach(MongoClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override public String serviceName() { return serviceName; }
    @Override public String uri() { return uri; }
    @Override public String databaseName() { return databaseName; }

    @Override
    public synchronized ReadyState readyState() {
        return state;
    }

    @Override
    public synchronized int retryCount() {
        return retryCount;
    }

    @Override
    public Flux<ReadyState> stateChanges() {
        return states.asFlux();
    }

    /** The logical database this handle points at. */
    public MongoDatabase database() {
        return requireClient().getDatabase(databaseName);
    }

    @Override
    public Mono<Void> ping() {
        return Mono.fromRunnable(this::pingBlocking)
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(this::closeBlocking)
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    void pingBlocking() {
        database().runCommand(new Document("ping", 1));
    }

    void closeBlocking() {
        MongoClient current;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            current = client;
            client = null;
            transition(ReadyState.DISCONNECTING, true);
        }
        drain();
        try {
            if (current != null) {
                current.close();
            }
        } finally {
            transition(ReadyState.DISCONNECTED, true);
            completeRequested = true;
            drain();
        }
    }

    /** A verified round trip proves the link even if no heartbeat event arrived yet. */
    void markConnected() {
        transition(ReadyState.CONNECTED, false);
        drain();
    }

    @Override
    public void clusterDescriptionChanged(ClusterDescriptionChangedEvent event) {
        boolean reachable = event.getNewDescription().getServerDescriptions().stream()
                .anyMatch(ServerDescription::isOk);
        synchronized (this) {
            if (closed) {
                return;
            }
            if (reachable) {
                transition(ReadyState.CONNECTED, false);
            } else if (state == ReadyState.CONNECTED) {
                transition(ReadyState.DISCONNECTED, false);
            }
        }
        drain();
    }

    @Override
    public void clusterClosed(ClusterClosedEvent event) {
        synchronized (this) {
            transition(ReadyState.DISCONNECTED, closed);
        }
        drain();
    }

    /**
     * @param fromClose whether the caller is the close path; only it may enter or leave DISCONNECTING
     * @return {@code false} when the transition was ignored
     */
    private synchronized boolean transition(ReadyState next, boolean fromClose) {
        if (state == next) {
            return false;
        }
        if (state == ReadyState.DISCONNECTING && !fromClose) {
            return false;
        }
        if (next == ReadyState.CONNECTED) {
            if (everConnected && state == ReadyState.DISCONNECTED) {
                retryCount++;
            }
            everConnected = true;
        }
        state = next;
        pending.offer(next);
        return true;
    }

    /** Emits queued states; must not be called while holding this handle's monitor. */
    private void drain() {
        if (emitting.getAndIncrement() != 0) {
            return;
        }
        do {
            ReadyState next;
            while ((next = pending.poll()) != null) {
                states.tryEmitNext(next);
            }
            if (completeRequested) {
                states.tryEmitComplete();
            }
        } while (emitting.decrementAndGet() != 0);
    }

    private MongoClient requireClient() {
        MongoClient current = client;
        if (current == null) {
            throw new IllegalStateException("Database connection for " + serviceName + " is closed");
        }
        return current;
    }
}
