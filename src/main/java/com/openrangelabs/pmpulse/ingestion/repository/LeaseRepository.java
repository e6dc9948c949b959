package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.Lease;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface LeaseRepository extends SyncedEntityRepository<Lease> {

    Flux<Lease> findByUnitId(UUID unitId);
}
