package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Write-once copy of one fetched remote record, kept for audit and replay.
 * Removed only together with its run by the retention job.
 */
@Table("raw_events")
public class RawEvent {

    @Id
    private UUID id;

    @Column("sync_run_id")
    private UUID syncRunId;

    @Column("resource_type")
    private String resourceType;

    @Column("external_id")
    private String externalId;

    private String payload;

    @Column("pulled_at")
    private LocalDateTime pulledAt = LocalDateTime.now();

    public RawEvent() {}

    public RawEvent(UUID syncRunId, String resourceType, String externalId, String payload) {
        this.syncRunId = syncRunId;
        this.resourceType = resourceType;
        this.externalId = externalId;
        this.payload = payload;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSyncRunId() { return syncRunId; }
    public void setSyncRunId(UUID syncRunId) { this.syncRunId = syncRunId; }

    public String getResourceType() { return resourceType; }
    public void setResourceType(String resourceType) { this.resourceType = resourceType; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }

    public LocalDateTime getPulledAt() { return pulledAt; }
    public void setPulledAt(LocalDateTime pulledAt) { this.pulledAt = pulledAt; }

    @Override
    public String toString() {
        return "RawEvent{" +
                "id=" + id +
                ", syncRunId=" + syncRunId +
                ", resourceType='" + resourceType + '\'' +
                ", externalId='" + externalId + '\'' +
                ", pulledAt=" + pulledAt +
                '}';
    }
}
