package com.visionai.gateway.database.single;

/**
 * Snapshot returned by {@link PrimaryDatabaseConnection#getStatus()}.
 */
public record PrimaryStatus(boolean connected, String readyState, String database, int retryCount, boolean failed) {
}
