package com.openrangelabs.pmpulse.ingestion.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for updating an API connection. Omitted fields keep their stored values.
 */
public class UpdateConnectionRequest {

    @Pattern(regexp = "^https?://.+", message = "API base URL must be an http(s) URL")
    private String apiBaseUrl;

    @Size(max = 255, message = "Client id must be at most 255 characters")
    private String clientId;

    private String clientSecret;

    public UpdateConnectionRequest() {}

    public UpdateConnectionRequest(String apiBaseUrl, String clientId, String clientSecret) {
        this.apiBaseUrl = apiBaseUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
}
