package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

/**
 * Repository for sync run history
 */
@Repository
public interface SyncRunRepository extends R2dbcRepository<SyncRun, UUID> {

    Flux<SyncRun> findByConnectionIdOrderByCreatedAtDesc(UUID connectionId);

    /**
     * Runs of a connection that are running and were started after the given time
     */
    @Query("""
        SELECT * FROM sync_runs
        WHERE connection_id = :connectionId
        AND status = 'RUNNING'
        AND started_at > :startedAfter
        ORDER BY started_at DESC
        """)
    Flux<SyncRun> findActiveRuns(@Param("connectionId") UUID connectionId,
                                 @Param("startedAfter") LocalDateTime startedAfter);

    @Query("""
        SELECT * FROM sync_runs
        WHERE connection_id = :connectionId
        AND status = 'COMPLETED'
        ORDER BY ended_at DESC
        LIMIT 1
        """)
    Mono<SyncRun> findLatestCompleted(@Param("connectionId") UUID connectionId);

    @Query("""
        SELECT * FROM sync_runs
        WHERE connection_id = :connectionId
        ORDER BY created_at DESC
        LIMIT 1
        """)
    Mono<SyncRun> findLatest(@Param("connectionId") UUID connectionId);

    /**
     * Terminal runs that ended before the threshold, oldest first, at most {@code limit}
     */
    @Query("""
        SELECT id FROM sync_runs
        WHERE status IN ('COMPLETED', 'FAILED')
        AND ended_at < :threshold
        ORDER BY ended_at ASC
        LIMIT :limit
        """)
    Flux<UUID> findExpiredRunIds(@Param("threshold") LocalDateTime threshold, @Param("limit") int limit);

    @Modifying
    @Query("DELETE FROM sync_runs WHERE id IN (:ids)")
    Mono<Integer> deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
