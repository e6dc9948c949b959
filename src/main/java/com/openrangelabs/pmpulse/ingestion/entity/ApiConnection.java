package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing one remote property-management account.
 * The client secret is stored encrypted and only decrypted per request.
 */
@Table("api_connections")
public class ApiConnection {

    @Id
    private UUID id;

    private String name;

    @Column("api_base_url")
    private String apiBaseUrl;

    @Column("client_id")
    private String clientId;

    @Column("client_secret_encrypted")
    private String clientSecretEncrypted;

    private String status = ConnectionStatus.UNCONFIGURED.name();

    @Column("last_success_at")
    private LocalDateTime lastSuccessAt;

    @Column("last_error")
    private String lastError;

    @Column("last_error_at")
    private LocalDateTime lastErrorAt;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column("updated_at")
    private LocalDateTime updatedAt = LocalDateTime.now();

    // Constructors
    public ApiConnection() {}

    public ApiConnection(String name, String apiBaseUrl, String clientId) {
        this.name = name;
        this.apiBaseUrl = apiBaseUrl;
        this.clientId = clientId;
    }

    // Business methods
    public boolean isConfigured() {
        return hasText(apiBaseUrl) && hasText(clientId) && hasText(clientSecretEncrypted);
    }

    public void markAsSuccess() {
        this.status = ConnectionStatus.CONNECTED.name();
        this.lastSuccessAt = LocalDateTime.now();
        this.lastError = null;
        this.updatedAt = LocalDateTime.now();
    }

    public void markAsError(String error) {
        this.status = ConnectionStatus.ERROR.name();
        this.lastError = error;
        this.lastErrorAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Recompute status after credentials change. A connection that has synced keeps its state.
     */
    public void refreshConfiguredStatus() {
        if (!isConfigured()) {
            this.status = ConnectionStatus.UNCONFIGURED.name();
        } else if (getConnectionStatus() == ConnectionStatus.UNCONFIGURED) {
            this.status = ConnectionStatus.CONFIGURED.name();
        }
        this.updatedAt = LocalDateTime.now();
    }

    public ConnectionStatus getConnectionStatus() {
        try {
            return ConnectionStatus.valueOf(status);
        } catch (IllegalArgumentException | NullPointerException e) {
            return ConnectionStatus.UNCONFIGURED;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecretEncrypted() { return clientSecretEncrypted; }
    public void setClientSecretEncrypted(String clientSecretEncrypted) { this.clientSecretEncrypted = clientSecretEncrypted; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public LocalDateTime getLastSuccessAt() { return lastSuccessAt; }
    public void setLastSuccessAt(LocalDateTime lastSuccessAt) { this.lastSuccessAt = lastSuccessAt; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public LocalDateTime getLastErrorAt() { return lastErrorAt; }
    public void setLastErrorAt(LocalDateTime lastErrorAt) { this.lastErrorAt = lastErrorAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApiConnection that = (ApiConnection) o;
        return java.util.Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ApiConnection{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", apiBaseUrl='" + apiBaseUrl + '\'' +
                ", status='" + status + '\'' +
                ", lastSuccessAt=" + lastSuccessAt +
                '}';
    }

    public enum ConnectionStatus {
        UNCONFIGURED,
        CONFIGURED,
        CONNECTED,
        ERROR
    }
}
