package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.SyncedEntity;
import com.openrangelabs.pmpulse.ingestion.model.UpsertResult;
import com.openrangelabs.pmpulse.ingestion.repository.SyncedEntityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Upsert-by-external-id template for resource handlers.
 * Subclasses only copy the synchronized fields, so columns owned by other
 * subsystems keep their stored values when a record is updated.
 */
public abstract class AbstractResourceHandler<E extends SyncedEntity> implements ResourceHandler {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final SyncedEntityRepository<E> repository;

    protected AbstractResourceHandler(SyncedEntityRepository<E> repository) {
        this.repository = repository;
    }

    @Override
    public Mono<UpsertResult> upsert(String externalId, JsonNode record) {
        return repository.findByExternalId(externalId)
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    E entity = createEntity();
                    entity.setExternalId(externalId);
                    return entity;
                }))
                .flatMap(entity -> {
                    boolean created = entity.isNew();
                    return Mono.defer(() -> applyRecord(record, entity))
                            .flatMap(mapped -> {
                                mapped.touch();
                                return repository.save(mapped);
                            })
                            .map(saved -> created ? UpsertResult.CREATED : UpsertResult.UPDATED);
                });
    }

    /**
     * Template method creating an empty local record
     */
    protected abstract E createEntity();

    /**
     * Template method copying the synchronized fields of the remote record onto the entity
     * and resolving its parent references
     */
    protected abstract Mono<E> applyRecord(JsonNode record, E entity);
}
