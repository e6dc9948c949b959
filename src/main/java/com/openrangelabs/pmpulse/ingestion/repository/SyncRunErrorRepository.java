package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.SyncRunError;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

@Repository
public interface SyncRunErrorRepository extends R2dbcRepository<SyncRunError, UUID> {

    Flux<SyncRunError> findBySyncRunIdOrderByOccurredAtAsc(UUID syncRunId);

    @Modifying
    @Query("DELETE FROM sync_run_errors WHERE sync_run_id IN (:runIds)")
    Mono<Integer> deleteBySyncRunIdIn(@Param("runIds") Collection<UUID> runIds);
}
