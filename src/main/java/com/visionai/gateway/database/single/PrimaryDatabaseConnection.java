package com.visionai.gateway.database.single;

import com.visionai.gateway.core.model.CleanupOutcome;
import com.visionai.gateway.database.config.DatabaseTarget;
import com.visionai.gateway.database.config.PrimaryDatabaseProperties;
import com.visionai.gateway.database.registry.DatabaseConnector;
import com.visionai.gateway.database.registry.DatabaseHandle;
import com.visionai.gateway.database.registry.ReadyState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * =====================================================================================================
 * PrimaryDatabaseConnection
 * =====================================================================================================
 *
 * PURPOSE
 * -------
 * One long-lived database connection that heals itself, for deployments that keep a single primary
 * store next to (or instead of) the per-service registry.
 *
 * RECONNECT POLICY
 * ----------------
 * - {@link #initialize()} retries a failed connect up to {@code maxRetries} times, waiting
 *   {@code baseDelay * attempt} before attempt n; past the cap the error propagates.
 * - An unexpected {@code disconnected} state schedules a reconnect after {@code baseDelay * attempt}.
 *   A successful reconnect resets the counter. Past {@code maxRetries} the connection is marked FAILED
 *   for good and nothing more is attempted.
 * - {@link #disconnect()} is explicit: it cancels pending reconnects and suppresses new ones.
 */
public class PrimaryDatabaseConnection {

    private static final Logger log = LoggerFactory.getLogger(PrimaryDatabaseConnection.class);

    public static final String SERVICE_NAME = "primary";

    private final DatabaseConnector connector;
    private final DatabaseTarget target;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Scheduler timer;

    private DatabaseHandle handle;
    private Disposable stateWatch;
    private Disposable pendingReconnect;
    private int reconnectAttempts;
    private boolean failed;
    private boolean closing;

    public PrimaryDatabaseConnection(DatabaseConnector connector, PrimaryDatabaseProperties props) {
        this(connector, props, Schedulers.parallel());
    }

    PrimaryDatabaseConnection(DatabaseConnector connector, PrimaryDatabaseProperties props, Scheduler timer) {
        this.connector = connector;
        this.target = props.toTarget();
        this.maxRetries = props.getMaxRetries();
        this.baseDelay = props.getBaseDelay();
        this.timer = timer;
    }

    /**
     * Connects, retrying with linear backoff. Emits the connected handle.
     */
    public Mono<DatabaseHandle> initialize() {
        return Mono.defer(() -> connector.connect(SERVICE_NAME, target))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    long attempt = signal.totalRetries() + 1;
                    if (attempt > maxRetries) {
                        log.error("Primary database connection failed after {} attempt(s): {}",
                                attempt, signal.failure().toString());
                        return Mono.error(signal.failure());
                    }
                    Duration delay = baseDelay.multipliedBy(attempt);
                    log.warn("Primary database connect failed (attempt {}/{}), retrying in {}: {}",
                            attempt, maxRetries, delay, signal.failure().toString());
                    return Mono.delay(delay, timer);
                })))
                .doOnNext(this::adopt);
    }

    /**
     * Never fails: ping errors are reported as {@code error}.
     */
    public Mono<HealthReport> healthCheck() {
        return Mono.defer(() -> {
            DatabaseHandle current;
            boolean permanentlyFailed;
            synchronized (this) {
                current = handle;
                permanentlyFailed = failed;
            }
            if (permanentlyFailed) {
                return Mono.just(new HealthReport("failed", false,
                        Map.of("reconnectAttempts", maxRetries, "database", target.getName())));
            }
            if (current == null || current.readyState() != ReadyState.CONNECTED) {
                String state = current == null ? ReadyState.DISCONNECTED.label() : current.readyState().label();
                return Mono.just(new HealthReport("disconnected", false,
                        Map.of("readyState", state, "database", target.getName())));
            }
            return current.ping()
                    .then(Mono.fromCallable(() -> {
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("database", current.databaseName());
                        details.put("readyState", current.readyState().label());
                        details.put("retryCount", current.retryCount());
                        return new HealthReport("connected", true, details);
                    }))
                    .onErrorResume(err -> Mono.just(new HealthReport("error", false,
                            Map.of("error", String.valueOf(err.getMessage())))));
        });
    }

    public PrimaryStatus getStatus() {
        DatabaseHandle current;
        int attempts;
        boolean permanentlyFailed;
        synchronized (this) {
            current = handle;
            attempts = reconnectAttempts;
            permanentlyFailed = failed;
        }
        // readyState() takes the handle's monitor; never call it while holding this one
        ReadyState state = current == null ? ReadyState.DISCONNECTED : current.readyState();
        return new PrimaryStatus(state == ReadyState.CONNECTED, state.label(), target.getName(),
                attempts, permanentlyFailed);
    }

    /**
     * Closes the connection and stops reconnecting. Never fails.
     */
    public Mono<CleanupOutcome> disconnect() {
        return Mono.defer(() -> {
            DatabaseHandle current;
            synchronized (this) {
                closing = true;
                disposeQuietly(pendingReconnect);
                disposeQuietly(stateWatch);
                pendingReconnect = null;
                stateWatch = null;
                current = handle;
                handle = null;
            }
            if (current == null) {
                return Mono.just(CleanupOutcome.ok(SERVICE_NAME, "disconnect"));
            }
            return current.close()
                    .thenReturn(CleanupOutcome.ok(SERVICE_NAME, "disconnect"))
                    .doOnNext(ok -> log.info("Primary database disconnected"))
                    .onErrorResume(err -> {
                        log.error("Error closing primary database: {}", err.toString());
                        return Mono.just(CleanupOutcome.failed(SERVICE_NAME, "disconnect", err));
                    });
        });
    }

    private void adopt(DatabaseHandle fresh) {
        synchronized (this) {
            if (closing) {
                fresh.close().subscribe(null, err -> log.warn("Error closing late connection: {}", err.toString()));
                return;
            }
            disposeQuietly(stateWatch);
            handle = fresh;
            reconnectAttempts = 0;
            stateWatch = fresh.stateChanges()
                    .filter(state -> state == ReadyState.DISCONNECTED)
                    .subscribe(state -> onUnexpectedDisconnect(fresh),
                            err -> log.error("Primary database state error: {}", err.toString()));
        }
        log.info("Primary database connected database={}", fresh.databaseName());
    }

    private synchronized void onUnexpectedDisconnect(DatabaseHandle source) {
        if (closing || source != handle) {
            return;
        }
        log.warn("Primary database disconnected unexpectedly");
        scheduleReconnect();
    }

    private synchronized void scheduleReconnect() {
        if (closing || failed || pendingReconnect != null) {
            return;
        }
        int attempt = ++reconnectAttempts;
        if (attempt > maxRetries) {
            failed = true;
            log.error("Primary database reconnect gave up after {} attempt(s); marked FAILED", maxRetries);
            return;
        }
        Duration delay = baseDelay.multipliedBy(attempt);
        log.info("Primary database reconnect attempt {}/{} in {}", attempt, maxRetries, delay);
        pendingReconnect = Mono.delay(delay, timer)
                .then(Mono.defer(this::reconnectOnce))
                .subscribe(
                        ignored -> { },
                        err -> {
                            log.warn("Primary database reconnect attempt {} failed: {}", attempt, err.toString());
                            synchronized (this) {
                                pendingReconnect = null;
                            }
                            scheduleReconnect();
                        },
                        () -> {
                            synchronized (this) {
                                pendingReconnect = null;
                            }
                        });
    }

    private Mono<Void> reconnectOnce() {
        DatabaseHandle stale;
        synchronized (this) {
            if (closing) {
                return Mono.empty();
            }
            stale = handle;
        }
        if (stale != null && stale.readyState() == ReadyState.CONNECTED) {
            synchronized (this) {
                if (handle == stale) {
                    reconnectAttempts = 0;
                }
            }
            log.info("Primary database link recovered");
            return Mono.empty();
        }
        Mono<Void> closeStale = stale == null ? Mono.empty() : stale.close()
                .onErrorResume(err -> {
                    log.debug("Ignoring close error on stale primary handle: {}", err.toString());
                    return Mono.empty();
                });
        return closeStale
                .then(connector.connect(SERVICE_NAME, target))
                .doOnNext(this::adopt)
                .then();
    }

    private static void disposeQuietly(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}
