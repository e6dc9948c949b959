package com.openrangelabs.pmpulse.ingestion.entity;

import com.openrangelabs.pmpulse.ingestion.model.ResourceError;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Table("sync_run_errors")
public class SyncRunError {

    @Id
    private UUID id;

    @Column("sync_run_id")
    private UUID syncRunId;

    @Column("resource_type")
    private String resourceType;

    private String message;

    private String context;

    @Column("occurred_at")
    private LocalDateTime occurredAt;

    public SyncRunError() {}

    public static SyncRunError of(UUID syncRunId, ResourceType type, ResourceError error) {
        SyncRunError row = new SyncRunError();
        row.syncRunId = syncRunId;
        row.resourceType = type.getKey();
        row.message = error.message();
        row.context = error.describeContext();
        row.occurredAt = error.occurredAt();
        return row;
    }

    public ResourceType getResourceTypeEnum() {
        return ResourceType.fromKey(resourceType);
    }

    /**
     * Rebuild the error value. The context is stored as "key=value, key=value".
     */
    public ResourceError toResourceError() {
        Map<String, String> values = new LinkedHashMap<>();
        if (context != null && !context.isBlank()) {
            for (String pair : context.split(", ")) {
                int separator = pair.indexOf('=');
                if (separator > 0) {
                    values.put(pair.substring(0, separator), pair.substring(separator + 1));
                }
            }
        }
        return new ResourceError(message, values, occurredAt);
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSyncRunId() { return syncRunId; }
    public void setSyncRunId(UUID syncRunId) { this.syncRunId = syncRunId; }

    public String getResourceType() { return resourceType; }
    public void setResourceType(String resourceType) { this.resourceType = resourceType; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public LocalDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(LocalDateTime occurredAt) { this.occurredAt = occurredAt; }
}
