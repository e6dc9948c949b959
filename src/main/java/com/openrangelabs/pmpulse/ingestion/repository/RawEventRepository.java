package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.RawEvent;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

/**
 * Append-only store of fetched remote records
 */
@Repository
public interface RawEventRepository extends R2dbcRepository<RawEvent, UUID> {

    Flux<RawEvent> findBySyncRunId(UUID syncRunId);

    Flux<RawEvent> findByResourceTypeAndExternalIdOrderByPulledAtDesc(String resourceType, String externalId);

    Mono<Long> countBySyncRunId(UUID syncRunId);

    @Modifying
    @Query("DELETE FROM raw_events WHERE sync_run_id IN (:runIds)")
    Mono<Integer> deleteBySyncRunIdIn(@Param("runIds") Collection<UUID> runIds);
}
