package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.Property;
import org.springframework.stereotype.Repository;

@Repository
public interface PropertyRepository extends SyncedEntityRepository<Property> {
}
