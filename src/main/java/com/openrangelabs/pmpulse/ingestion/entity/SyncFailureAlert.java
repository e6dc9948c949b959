package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Consecutive-failure state of one connection. Exactly one row per connection.
 * The failure counter only grows on failures and is reset to zero by a successful run.
 */
@Table("sync_failure_alerts")
public class SyncFailureAlert {

    @Id
    private UUID id;

    @Column("connection_id")
    private UUID connectionId;

    @Column("consecutive_failures")
    private Integer consecutiveFailures = 0;

    @Column("last_failure_at")
    private LocalDateTime lastFailureAt;

    @Column("last_alert_sent_at")
    private LocalDateTime lastAlertSentAt;

    @Column("acknowledged_at")
    private LocalDateTime acknowledgedAt;

    @Column("acknowledged_by")
    private String acknowledgedBy;

    @Column("failure_details")
    private String failureDetails = "[]";

    @Column("updated_at")
    private LocalDateTime updatedAt = LocalDateTime.now();

    // Constructors
    public SyncFailureAlert() {}

    public SyncFailureAlert(UUID connectionId) {
        this.connectionId = connectionId;
    }

    // Business methods

    /**
     * Count a failed run. A new failure always clears an earlier acknowledgment.
     */
    public void recordFailure(LocalDateTime now, String failureDetailsJson) {
        this.consecutiveFailures = consecutiveFailures + 1;
        this.lastFailureAt = now;
        this.failureDetails = failureDetailsJson;
        this.acknowledgedAt = null;
        this.acknowledgedBy = null;
        this.updatedAt = now;
    }

    /**
     * Reset after a successful run. Acknowledgment state is left as is.
     */
    public void resetFailures(LocalDateTime now) {
        this.consecutiveFailures = 0;
        this.updatedAt = now;
    }

    public void markAlertSent(LocalDateTime now) {
        this.lastAlertSentAt = now;
        this.updatedAt = now;
    }

    public void acknowledge(String user, LocalDateTime now) {
        this.acknowledgedAt = now;
        this.acknowledgedBy = user;
        this.updatedAt = now;
    }

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }

    public boolean hasFailures() {
        return consecutiveFailures != null && consecutiveFailures > 0;
    }

    /**
     * Whether an alert may go out now: never while acknowledged, always if none was sent,
     * otherwise once the cooldown has elapsed since the last one.
     */
    public boolean isAlertDue(LocalDateTime now, int cooldownMinutes) {
        if (isAcknowledged()) {
            return false;
        }
        if (lastAlertSentAt == null) {
            return true;
        }
        return Duration.between(lastAlertSentAt, now).toMinutes() >= cooldownMinutes;
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getConnectionId() { return connectionId; }
    public void setConnectionId(UUID connectionId) { this.connectionId = connectionId; }

    public Integer getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(Integer consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }

    public LocalDateTime getLastFailureAt() { return lastFailureAt; }
    public void setLastFailureAt(LocalDateTime lastFailureAt) { this.lastFailureAt = lastFailureAt; }

    public LocalDateTime getLastAlertSentAt() { return lastAlertSentAt; }
    public void setLastAlertSentAt(LocalDateTime lastAlertSentAt) { this.lastAlertSentAt = lastAlertSentAt; }

    public LocalDateTime getAcknowledgedAt() { return acknowledgedAt; }
    public void setAcknowledgedAt(LocalDateTime acknowledgedAt) { this.acknowledgedAt = acknowledgedAt; }

    public String getAcknowledgedBy() { return acknowledgedBy; }
    public void setAcknowledgedBy(String acknowledgedBy) { this.acknowledgedBy = acknowledgedBy; }

    public String getFailureDetails() { return failureDetails; }
    public void setFailureDetails(String failureDetails) { this.failureDetails = failureDetails; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncFailureAlert that = (SyncFailureAlert) o;
        return java.util.Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncFailureAlert{" +
                "connectionId=" + connectionId +
                ", consecutiveFailures=" + consecutiveFailures +
                ", lastAlertSentAt=" + lastAlertSentAt +
                ", acknowledgedAt=" + acknowledgedAt +
                ", acknowledgedBy='" + acknowledgedBy + '\'' +
                '}';
    }
}
