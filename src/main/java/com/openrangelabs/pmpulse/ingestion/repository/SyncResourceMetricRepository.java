package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.SyncResourceMetric;
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
public interface SyncResourceMetricRepository extends R2dbcRepository<SyncResourceMetric, UUID> {

    Flux<SyncResourceMetric> findBySyncRunId(UUID syncRunId);

    @Modifying
    @Query("DELETE FROM sync_resource_metrics WHERE sync_run_id IN (:runIds)")
    Mono<Integer> deleteBySyncRunIdIn(@Param("runIds") Collection<UUID> runIds);
}
