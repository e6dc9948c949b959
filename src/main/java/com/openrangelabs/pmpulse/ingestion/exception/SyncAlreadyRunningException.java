package com.openrangelabs.pmpulse.ingestion.exception;

import java.util.UUID;

/**
 * Exception thrown when a run is requested while another run holds the connection.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class SyncAlreadyRunningException extends IngestionException {

    private final UUID connectionId;

    public SyncAlreadyRunningException(UUID connectionId) {
        super(String.format("A sync is already running for connection %s", connectionId));
        this.connectionId = connectionId;
    }

    public UUID getConnectionId() {
        return connectionId;
    }
}
