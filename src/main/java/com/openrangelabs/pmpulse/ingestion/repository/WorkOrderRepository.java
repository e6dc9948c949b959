package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.WorkOrder;
import org.springframework.stereotype.Repository;

@Repository
public interface WorkOrderRepository extends SyncedEntityRepository<WorkOrder> {
}
