package com.openrangelabs.pmpulse.ingestion.repository;

import com.openrangelabs.pmpulse.ingestion.entity.Expense;
import org.springframework.stereotype.Repository;

@Repository
public interface ExpenseRepository extends SyncedEntityRepository<Expense> {
}
