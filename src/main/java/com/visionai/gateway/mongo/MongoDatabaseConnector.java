package com.visionai.gateway.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.visionai.gateway.database.config.DatabaseTarget;
import com.visionai.gateway.database.registry.DatabaseConnector;
import com.visionai.gateway.database.registry.DatabaseHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Opens {@link MongoDatabaseHandle}s with the sync driver.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li>server selection and socket connect bounded by {@code connectTimeout}</li>
 *   <li>socket reads and pooled idle connections bounded by {@code socketTimeout}</li>
 *   <li>pool capped at {@code maxPoolSize}</li>
 * </ul>
 *
 * The driver call blocks, so it runs on {@code boundedElastic}. The handle only emits after a
 * {@code ping} round trip; a failed ping closes the client before the error propagates.
 */
public class MongoDatabaseConnector implements DatabaseConnector {

    private static final Logger log = LoggerFactory.getLogger(MongoDatabaseConnector.class);

    private final String applicationName;
    private final Duration connectTimeout;
    private final Duration socketTimeout;
    private final int maxPoolSize;
    private final Function<MongoClientSettings, MongoClient> clientFactory;

    public MongoDatabaseConnector(String applicationName, Duration connectTimeout, Duration socketTimeout,
                                  int maxPoolSize) {
        this(applicationName, connectTimeout, socketTimeout, maxPoolSize, MongoClients::create);
    }

    MongoDatabaseConnector(String applicationName, Duration connectTimeout, Duration socketTimeout,
                           int maxPoolSize, Function<MongoClientSettings, MongoClient> clientFactory) {
        this.applicationName = applicationName;
        this.connectTimeout = connectTimeout;
        this.socketTimeout = socketTimeout;
        this.maxPoolSize = maxPoolSize;
        this.clientFactory = clientFactory;
    }

    @Override
    public Mono<DatabaseHandle> connect(String serviceName, DatabaseTarget target) {
        return Mono.fromCallable(() -> open(serviceName, target))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private DatabaseHandle open(String serviceName, DatabaseTarget target) {
        MongoDatabaseHandle handle = new MongoDatabaseHandle(serviceName, target.getUri(), target.getName());
        handle.attach(clientFactory.apply(settings(serviceName, target, handle)));
        try {
            handle.pingBlocking();
        } catch (RuntimeException e) {
            handle.closeBlocking();
            throw e;
        }
        handle.markConnected();
        log.debug("Mongo ping ok service={} database={}", serviceName, target.getName());
        return handle;
    }

    MongoClientSettings settings(String serviceName, DatabaseTarget target, MongoDatabaseHandle listener) {
        long connectMillis = connectTimeout.toMillis();
        long socketMillis = socketTimeout.toMillis();
        return MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(target.getUri()))
                .applicationName(applicationName + "-" + serviceName)
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(connectMillis, TimeUnit.MILLISECONDS)
                        .addClusterListener(listener))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout((int) connectMillis, TimeUnit.MILLISECONDS)
                        .readTimeout((int) socketMillis, TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(maxPoolSize)
                        .maxConnectionIdleTime(socketMillis, TimeUnit.MILLISECONDS))
                .build();
    }
}
