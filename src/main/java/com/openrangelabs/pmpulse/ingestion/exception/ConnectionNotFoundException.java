package com.openrangelabs.pmpulse.ingestion.exception;

import java.util.UUID;

/**
 * Exception thrown when a requested connection does not exist.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ConnectionNotFoundException extends IngestionException {

    private final UUID connectionId;

    public ConnectionNotFoundException(UUID connectionId) {
        super(String.format("Connection not found with ID: %s", connectionId));
        this.connectionId = connectionId;
    }

    public UUID getConnectionId() {
        return connectionId;
    }
}
