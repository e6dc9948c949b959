package com.openrangelabs.pmpulse.ingestion.exception;

import java.util.UUID;

/**
 * Exception thrown when a sync is requested for a connection without complete credentials.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ConnectionNotConfiguredException extends IngestionException {

    public ConnectionNotConfiguredException(UUID connectionId) {
        super(String.format("Connection %s is not configured. Set the API base URL, client id and client secret first.",
                connectionId));
    }
}
