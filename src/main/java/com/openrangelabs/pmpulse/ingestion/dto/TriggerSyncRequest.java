package com.openrangelabs.pmpulse.ingestion.dto;

import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import jakarta.validation.constraints.Pattern;

/**
 * Request DTO for triggering a sync run
 */
public class TriggerSyncRequest {

    @Pattern(regexp = "^(full|incremental)$", message = "Mode must be one of: full, incremental")
    private String mode = SyncMode.INCREMENTAL.getValue();

    private boolean force;

    // Constructors
    public TriggerSyncRequest() {}

    public TriggerSyncRequest(String mode, boolean force) {
        this.mode = mode;
        this.force = force;
    }

    // Getters and Setters
    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public boolean isForce() { return force; }
    public void setForce(boolean force) { this.force = force; }

    // Helper methods
    public SyncMode getSyncMode() {
        return mode == null ? SyncMode.INCREMENTAL : SyncMode.fromValue(mode);
    }

    @Override
    public String toString() {
        return "TriggerSyncRequest{" +
                "mode='" + mode + '\'' +
                ", force=" + force +
                '}';
    }
}
