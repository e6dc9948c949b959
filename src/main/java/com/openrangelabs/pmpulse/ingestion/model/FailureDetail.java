package com.openrangelabs.pmpulse.ingestion.model;

import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Context of one failed run, kept in the connection's bounded failure history
 */
public record FailureDetail(UUID syncRunId, String error, int errorsCount, String mode, LocalDateTime occurredAt) {

    public static FailureDetail of(SyncRun run, LocalDateTime occurredAt) {
        String error = run.getErrorSummary() != null ? run.getErrorSummary() : "Sync failed";
        int errors = run.getErrorsCount() != null ? run.getErrorsCount() : 0;
        return new FailureDetail(run.getId(), error, errors, run.getMode(), occurredAt);
    }
}
