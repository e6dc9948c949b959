package com.openrangelabs.pmpulse.ingestion.exception;

/**
 * Exception thrown when a remote record cannot be mapped to the local schema.
 * Recorded as a record-level error, processing continues with the next record.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class RecordMappingException extends IngestionException {

    public RecordMappingException(String message) {
        super(message);
    }

    public RecordMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
