package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.Vendor;
import org.springframework.stereotype.Repository;

@Repository
public interface VendorRepository extends SyncedEntityRepository<Vendor> {
}
