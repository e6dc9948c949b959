package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.model.UpsertResult;
import com.openrangelabs.pmpulse.ingestion.sync.SyncSession;
import reactor.core.publisher.Mono;

/**
 * Maps and stores the records of one remote resource type
 */
public interface ResourceHandler {

    /**
     * Get the resource type this handler writes
     */
    ResourceType getResourceType();

    /**
     * Map one remote record and create or update the local record with the same external id.
     * Signals {@link com.openrangelabs.pmpulse.ingestion.exception.UnresolvedReferenceException} when a
     * required parent is missing and {@link com.openrangelabs.pmpulse.ingestion.exception.RecordMappingException}
     * when the record is malformed. Nothing is written in either case.
     */
    Mono<UpsertResult> upsert(String externalId, JsonNode record);

    /**
     * Hook run once after every record of the resource was processed in a run
     */
    default Mono<Void> afterResource(SyncSession session) {
        return Mono.empty();
    }
}
