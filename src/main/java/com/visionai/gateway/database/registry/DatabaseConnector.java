package com.visionai.gateway.database.registry;

import com.visionai.gateway.database.config.DatabaseTarget;
import reactor.core.publisher.Mono;

/**
 * Opens a new database handle. Implementations verify the connection (round trip) before emitting and close
 * it again on failure; they never retry.
 */
@FunctionalInterface
public interface DatabaseConnector {

    Mono<DatabaseHandle> connect(String serviceName, DatabaseTarget target);
}
