package com.openrangelabs.pmpulse.ingestion.entity;

import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

/**
 * Persisted metrics snapshot of one resource within one run.
 * (sync_run_id, resource_type) is unique.
 */
@Table("sync_resource_metrics")
public class SyncResourceMetric {

    @Id
    private UUID id;

    @Column("sync_run_id")
    private UUID syncRunId;

    @Column("resource_type")
    private String resourceType;

    @Column("created_count")
    private Integer createdCount = 0;

    @Column("updated_count")
    private Integer updatedCount = 0;

    @Column("skipped_count")
    private Integer skippedCount = 0;

    @Column("error_count")
    private Integer errorCount = 0;

    @Column("duration_ms")
    private Long durationMs = 0L;

    public SyncResourceMetric() {}

    public static SyncResourceMetric of(UUID syncRunId, ResourceType type, ResourceMetrics metrics) {
        SyncResourceMetric row = new SyncResourceMetric();
        row.syncRunId = syncRunId;
        row.resourceType = type.getKey();
        row.createdCount = metrics.created();
        row.updatedCount = metrics.updated();
        row.skippedCount = metrics.skipped();
        row.errorCount = metrics.errors();
        row.durationMs = metrics.durationMs();
        return row;
    }

    public ResourceMetrics toMetrics() {
        return new ResourceMetrics(createdCount, updatedCount, skippedCount, errorCount, durationMs);
    }

    public ResourceType getResourceTypeEnum() {
        return ResourceType.fromKey(resourceType);
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSyncRunId() { return syncRunId; }
    public void setSyncRunId(UUID syncRunId) { this.syncRunId = syncRunId; }

    public String getResourceType() { return resourceType; }
    public void setResourceType(String resourceType) { this.resourceType = resourceType; }

    public Integer getCreatedCount() { return createdCount; }
    public void setCreatedCount(Integer createdCount) { this.createdCount = createdCount; }

    public Integer getUpdatedCount() { return updatedCount; }
    public void setUpdatedCount(Integer updatedCount) { this.updatedCount = updatedCount; }

    public Integer getSkippedCount() { return skippedCount; }
    public void setSkippedCount(Integer skippedCount) { this.skippedCount = skippedCount; }

    public Integer getErrorCount() { return errorCount; }
    public void setErrorCount(Integer errorCount) { this.errorCount = errorCount; }

    public Long getDurationMs() { return durationMs; }
    public void setDurationMs(Long durationMs) { this.durationMs = durationMs; }
}
