package com.openrangelabs.pmpulse.ingestion.model;

/**
 * Outcome of writing one remote record to the local store
 */
public enum UpsertResult {
    CREATED,
    UPDATED
}
