package com.openrangelabs.pmpulse.ingestion.exception;

/**
 * Base exception for sync pipeline and connection management operations.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
