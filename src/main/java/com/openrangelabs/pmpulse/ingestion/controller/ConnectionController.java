package com.openrangelabs.pmpulse.ingestion.controller;

import com.openrangelabs.pmpulse.ingestion.dto.CreateConnectionRequest;
import com.openrangelabs.pmpulse.ingestion.dto.UpdateConnectionRequest;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.service.ConnectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for managing remote API connections.
 * Client secrets are accepted on write and never returned.
 */
@RestController
@RequestMapping("/api/connections")
@Tag(name = "Connections", description = "Remote API connection management")
public class ConnectionController {

    private final ConnectionService connectionService;

    @Autowired
    public ConnectionController(ConnectionService connectionService) {
        this.connectionService = connectionService;
    }

    @PostMapping
    @Operation(summary = "Create a connection")
    public Mono<ResponseEntity<Map<String, Object>>> createConnection(
            @Valid @RequestBody CreateConnectionRequest request) {

        return connectionService.createConnection(request.getName(), request.getApiBaseUrl(),
                        request.getClientId(), request.getClientSecret())
                .map(connection -> ResponseEntity.status(HttpStatus.CREATED).body(toResponse(connection)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a connection; omitted fields are kept")
    public Mono<ResponseEntity<Map<String, Object>>> updateConnection(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateConnectionRequest request) {

        return connectionService.updateConnection(id, request.getApiBaseUrl(), request.getClientId(),
                        request.getClientSecret())
                .map(connection -> ResponseEntity.ok(toResponse(connection)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a connection")
    public Mono<ResponseEntity<Map<String, Object>>> getConnection(@PathVariable UUID id) {
        return connectionService.getConnection(id)
                .map(connection -> ResponseEntity.ok(toResponse(connection)));
    }

    @GetMapping("/{id}/test")
    @Operation(summary = "Probe the remote API with the stored credentials")
    public Mono<ResponseEntity<Map<String, Object>>> testConnection(@PathVariable UUID id) {
        return connectionService.testConnection(id)
                .map(connected -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("connectionId", id);
                    response.put("connected", connected);
                    response.put("status", connected ? "SUCCESS" : "FAILED");
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    static Map<String, Object> toResponse(ApiConnection connection) {
        Map<String, Object> response = new HashMap<>();
        response.put("id", connection.getId());
        response.put("name", connection.getName());
        response.put("apiBaseUrl", connection.getApiBaseUrl());
        response.put("clientId", connection.getClientId());
        response.put("hasClientSecret", connection.getClientSecretEncrypted() != null);
        response.put("configured", connection.isConfigured());
        response.put("status", connection.getConnectionStatus().name().toLowerCase());
        response.put("lastSuccessAt", connection.getLastSuccessAt());
        response.put("lastError", connection.getLastError());
        response.put("lastErrorAt", connection.getLastErrorAt());
        response.put("updatedAt", connection.getUpdatedAt());
        return response;
    }
}
