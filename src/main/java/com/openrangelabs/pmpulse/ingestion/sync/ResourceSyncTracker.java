package com.openrangelabs.pmpulse.ingestion.sync;

import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.model.ResourceError;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Counts the outcome of every record of one resource type within one run.
 * Duration runs from construction to {@link #finish()}, which writes the snapshot into the run.
 */
public class ResourceSyncTracker {

    private static final Logger logger = LoggerFactory.getLogger(ResourceSyncTracker.class);

    private final SyncRun syncRun;
    private final ResourceType resourceType;
    private final Clock clock;
    private final Instant startedAt;

    private int created;
    private int updated;
    private int skipped;
    private int errors;
    private final List<String> errorMessages = new ArrayList<>();
    private final List<String> skipReasons = new ArrayList<>();
    private String failureMessage;

    private ResourceMetrics finalMetrics;

    public ResourceSyncTracker(SyncRun syncRun, ResourceType resourceType) {
        this(syncRun, resourceType, Clock.systemUTC());
    }

    public ResourceSyncTracker(SyncRun syncRun, ResourceType resourceType, Clock clock) {
        this.syncRun = syncRun;
        this.resourceType = resourceType;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordCreated() {
        requireOpen();
        created++;
    }

    public void recordUpdated() {
        requireOpen();
        updated++;
    }

    public void recordSkipped(String reason) {
        requireOpen();
        skipped++;
        if (reason != null) {
            skipReasons.add(reason);
        }
        logger.debug("Skipped {} record: {}", resourceType.getKey(), reason);
    }

    /**
     * Count an error and attach it to the run's error list for this resource
     */
    public void recordError(String message, Map<String, String> context) {
        requireOpen();
        errors++;
        errorMessages.add(message);
        syncRun.addResourceError(resourceType, new ResourceError(message, context,
                LocalDateTime.ofInstant(clock.instant(), clock.getZone())));
        logger.warn("Error syncing {} {}: {}", resourceType.getKey(), context, message);
    }

    /**
     * Record an error that aborted the whole resource. The owning run cannot complete successfully.
     */
    public void recordFailure(String message, Map<String, String> context) {
        recordError(message, context);
        if (failureMessage == null) {
            failureMessage = message;
        }
    }

    public boolean isFailed() {
        return failureMessage != null;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public ResourceMetrics getMetrics() {
        if (finalMetrics != null) {
            return finalMetrics;
        }
        long durationMs = clock.millis() - startedAt.toEpochMilli();
        return new ResourceMetrics(created, updated, skipped, errors, durationMs);
    }

    public int getProcessedCount() {
        return created + updated;
    }

    public boolean hasErrors() {
        return errors > 0;
    }

    public List<String> getErrorMessages() {
        return Collections.unmodifiableList(errorMessages);
    }

    public List<String> getSkipReasons() {
        return Collections.unmodifiableList(skipReasons);
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public boolean isFinished() {
        return finalMetrics != null;
    }

    /**
     * Freeze the counters and store them in the run under this resource type
     */
    public ResourceMetrics finish() {
        requireOpen();
        ResourceMetrics metrics = getMetrics();
        syncRun.recordResourceMetrics(resourceType, metrics);
        this.finalMetrics = metrics;

        logger.info("Finished {} for run {}: created={}, updated={}, skipped={}, errors={}, duration={}ms",
                resourceType.getKey(), syncRun.getId(), metrics.created(), metrics.updated(),
                metrics.skipped(), metrics.errors(), metrics.durationMs());
        return metrics;
    }

    private void requireOpen() {
        if (finalMetrics != null) {
            throw new IllegalStateException("Tracker for " + resourceType.getKey() + " is already finished");
        }
    }
}
