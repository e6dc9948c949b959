package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.SyncedEntity;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.NoRepositoryBean;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Base repository for records upserted by external id
 */
@NoRepositoryBean
public interface SyncedEntityRepository<E extends SyncedEntity> extends R2dbcRepository<E, UUID> {

    Mono<E> findByExternalId(String externalId);
}
