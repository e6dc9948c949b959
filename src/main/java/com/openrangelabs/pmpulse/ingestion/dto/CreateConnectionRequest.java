package com.openrangelabs.pmpulse.ingestion.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating an API connection
 */
public class CreateConnectionRequest {

    @NotBlank(message = "Name is required")
    @Size(min = 3, max = 100, message = "Name must be between 3 and 100 characters")
    private String name;

    @Pattern(regexp = "^https?://.+", message = "API base URL must be an http(s) URL")
    private String apiBaseUrl;

    @Size(max = 255, message = "Client id must be at most 255 characters")
    private String clientId;

    private String clientSecret;

    // Constructors
    public CreateConnectionRequest() {}

    public CreateConnectionRequest(String name, String apiBaseUrl, String clientId, String clientSecret) {
        this.name = name;
        this.apiBaseUrl = apiBaseUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    // Getters and Setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

    @Override
    public String toString() {
        return "CreateConnectionRequest{" +
                "name='" + name + '\'' +
                ", apiBaseUrl='" + apiBaseUrl + '\'' +
                ", clientId='" + clientId + '\'' +
                ", clientSecret=" + (clientSecret != null ? "[PROTECTED]" : "null") +
                '}';
    }
}
