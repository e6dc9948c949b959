package com.openrangelabs.pmpulse.ingestion.entity;

import com.openrangelabs.pmpulse.ingestion.model.ResourceError;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entity representing one ingestion attempt for a connection.
 * Moves pending → running → completed | failed and is immutable once terminal.
 */
@Table("sync_runs")
public class SyncRun {

    public static final int MAX_ERRORS_PER_RESOURCE = 10;

    @Id
    private UUID id;

    @Column("connection_id")
    private UUID connectionId;

    private String mode;

    private String status = RunStatus.PENDING.name();

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("ended_at")
    private LocalDateTime endedAt;

    @Column("resources_synced")
    private Integer resourcesSynced = 0;

    @Column("errors_count")
    private Integer errorsCount = 0;

    @Column("error_summary")
    private String errorSummary;

    @Column("triggered_by")
    private String triggeredBy;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Transient
    private final Map<ResourceType, ResourceMetrics> resourceMetrics = new EnumMap<>(ResourceType.class);

    @Transient
    private final Map<ResourceType, List<ResourceError>> resourceErrors = new EnumMap<>(ResourceType.class);

    // Constructors
    public SyncRun() {}

    public SyncRun(UUID connectionId, SyncMode mode, String triggeredBy) {
        this.connectionId = connectionId;
        this.mode = mode.getValue();
        this.triggeredBy = triggeredBy;
    }

    // Business methods
    public void start(LocalDateTime now) {
        if (!isPending()) {
            throw new IllegalStateException("Sync run " + id + " cannot be started from status " + status);
        }
        this.status = RunStatus.RUNNING.name();
        this.startedAt = now;
    }

    public void complete(LocalDateTime now) {
        requireRunning();
        this.status = RunStatus.COMPLETED.name();
        this.endedAt = now;
    }

    public void fail(String errorSummary, LocalDateTime now) {
        if (isTerminal()) {
            throw new IllegalStateException("Sync run " + id + " is already " + status);
        }
        this.status = RunStatus.FAILED.name();
        this.endedAt = now;
        this.errorSummary = errorSummary;
    }

    /**
     * Store the finalized metrics of one resource. A resource can only be finalized once per run.
     */
    public void recordResourceMetrics(ResourceType resourceType, ResourceMetrics metrics) {
        requireRunning();
        if (resourceMetrics.containsKey(resourceType)) {
            throw new IllegalStateException("Metrics for " + resourceType.getKey() + " already recorded in run " + id);
        }
        resourceMetrics.put(resourceType, metrics);
    }

    /**
     * Keep the most recent errors per resource
     */
    public void addResourceError(ResourceType resourceType, ResourceError error) {
        List<ResourceError> errors = resourceErrors.computeIfAbsent(resourceType, key -> new ArrayList<>());
        errors.add(error);
        if (errors.size() > MAX_ERRORS_PER_RESOURCE) {
            errors.remove(0);
        }
    }

    /**
     * Attach metrics loaded from storage to a finished run
     */
    public void restoreResourceMetrics(ResourceType resourceType, ResourceMetrics metrics) {
        resourceMetrics.put(resourceType, metrics);
    }

    public boolean hasRecordedMetrics(ResourceType resourceType) {
        return resourceMetrics.containsKey(resourceType);
    }

    public int getTotalErrorCount() {
        return resourceMetrics.values().stream().mapToInt(ResourceMetrics::errors).sum();
    }

    public boolean isPending() {
        return RunStatus.PENDING.name().equals(status);
    }

    public boolean isRunning() {
        return RunStatus.RUNNING.name().equals(status);
    }

    public boolean isCompleted() {
        return RunStatus.COMPLETED.name().equals(status);
    }

    public boolean isFailed() {
        return RunStatus.FAILED.name().equals(status);
    }

    public boolean isTerminal() {
        return isCompleted() || isFailed();
    }

    public SyncMode getSyncMode() {
        return SyncMode.fromValue(mode);
    }

    public RunStatus getRunStatus() {
        try {
            return RunStatus.valueOf(status);
        } catch (IllegalArgumentException e) {
            return RunStatus.UNKNOWN;
        }
    }

    public Duration getDuration() {
        if (startedAt == null) return Duration.ZERO;
        LocalDateTime endTime = endedAt != null ? endedAt : LocalDateTime.now();
        return Duration.between(startedAt, endTime);
    }

    private void requireRunning() {
        if (!isRunning()) {
            throw new IllegalStateException("Sync run " + id + " is not running (status " + status + ")");
        }
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getConnectionId() { return connectionId; }
    public void setConnectionId(UUID connectionId) { this.connectionId = connectionId; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getEndedAt() { return endedAt; }
    public void setEndedAt(LocalDateTime endedAt) { this.endedAt = endedAt; }

    public Integer getResourcesSynced() { return resourcesSynced; }
    public void setResourcesSynced(Integer resourcesSynced) { this.resourcesSynced = resourcesSynced; }

    public Integer getErrorsCount() { return errorsCount; }
    public void setErrorsCount(Integer errorsCount) { this.errorsCount = errorsCount; }

    public String getErrorSummary() { return errorSummary; }
    public void setErrorSummary(String errorSummary) { this.errorSummary = errorSummary; }

    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public Map<ResourceType, ResourceMetrics> getResourceMetrics() {
        return Collections.unmodifiableMap(resourceMetrics);
    }

    public Map<ResourceType, List<ResourceError>> getResourceErrors() {
        return Collections.unmodifiableMap(resourceErrors);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncRun that = (SyncRun) o;
        return java.util.Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncRun{" +
                "id=" + id +
                ", connectionId=" + connectionId +
                ", mode='" + mode + '\'' +
                ", status='" + status + '\'' +
                ", resourcesSynced=" + resourcesSynced +
                ", errorsCount=" + errorsCount +
                ", startedAt=" + startedAt +
                ", endedAt=" + endedAt +
                ", duration=" + (isTerminal() ? getDuration() : "ongoing") +
                '}';
    }

    public enum RunStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        UNKNOWN
    }
}
