package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.Unit;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface UnitRepository extends SyncedEntityRepository<Unit> {

    Flux<Unit> findByPropertyId(UUID propertyId);

    /**
     * Mark every unit that has an active lease as occupied
     */
    @Modifying
    @Query("""
        UPDATE units SET status = 'occupied', updated_at = CURRENT_TIMESTAMP
        WHERE status <> 'occupied'
        AND id IN (SELECT unit_id FROM leases WHERE status = 'active')
        """)
    Mono<Integer> markUnitsWithActiveLeasesOccupied();
}
