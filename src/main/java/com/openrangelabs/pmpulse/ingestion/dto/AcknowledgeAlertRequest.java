package com.openrangelabs.pmpulse.ingestion.dto;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for acknowledging a failure alert. Defaults to the authenticated user when no name is given.
 */
public class AcknowledgeAlertRequest {

    @Size(max = 255, message = "Acknowledged by must be at most 255 characters")
    private String acknowledgedBy;

    public AcknowledgeAlertRequest() {}

    public AcknowledgeAlertRequest(String acknowledgedBy) {
        this.acknowledgedBy = acknowledgedBy;
    }

    public String getAcknowledgedBy() { return acknowledgedBy; }
    public void setAcknowledgedBy(String acknowledgedBy) { this.acknowledgedBy = acknowledgedBy; }
}
