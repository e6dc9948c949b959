package com.openrangelabs.pmpulse.ingestion.exception;

/**
 * Exception signalling that a record refers to a parent that does not exist locally.
 * The record is skipped rather than stored as an orphan.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class UnresolvedReferenceException extends IngestionException {

    private final String referenceType;
    private final String externalId;

    public UnresolvedReferenceException(String referenceType, String externalId) {
        super(String.format("Missing related %s: %s", referenceType, externalId));
        this.referenceType = referenceType;
        this.externalId = externalId;
    }

    public String getReferenceType() {
        return referenceType;
    }

    public String getExternalId() {
        return externalId;
    }
}
