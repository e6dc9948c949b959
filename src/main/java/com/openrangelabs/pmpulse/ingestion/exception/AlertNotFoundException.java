package com.openrangelabs.pmpulse.ingestion.exception;

import java.util.UUID;

public class AlertNotFoundException extends IngestionException {

    public AlertNotFoundException(UUID connectionId) {
        super(String.format("No failure alert recorded for connection %s", connectionId));
    }
}
