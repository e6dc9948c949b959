package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.SyncFailureAlert;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface SyncFailureAlertRepository extends R2dbcRepository<SyncFailureAlert, UUID> {

    Mono<SyncFailureAlert> findByConnectionId(UUID connectionId);

    /**
     * Unacknowledged alerts at or above the failure threshold
     */
    @Query("""
        SELECT * FROM sync_failure_alerts
        WHERE consecutive_failures >= :threshold
        AND acknowledged_at IS NULL
        ORDER BY consecutive_failures DESC
        """)
    Flux<SyncFailureAlert> findActive(@Param("threshold") int threshold);
}
