package com.openrangelabs.pmpulse.ingestion.controller;

import com.openrangelabs.pmpulse.ingestion.dto.AcknowledgeAlertRequest;
import com.openrangelabs.pmpulse.ingestion.entity.SyncFailureAlert;
import com.openrangelabs.pmpulse.ingestion.service.FailureEscalationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for sync failure alerts
 */
@RestController
@RequestMapping("/api/alerts")
@Tag(name = "Alerts", description = "Consecutive sync failure alerts")
public class AlertController {

    private final FailureEscalationService escalationService;

    @Autowired
    public AlertController(FailureEscalationService escalationService) {
        this.escalationService = escalationService;
    }

    @GetMapping
    @Operation(summary = "Unacknowledged alerts at or above the failure threshold")
    public Mono<ResponseEntity<Map<String, Object>>> getActiveAlerts() {
        return escalationService.getActiveAlerts()
                .map(this::toResponse)
                .collectList()
                .map(alerts -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("alerts", alerts);
                    response.put("count", alerts.size());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    @GetMapping("/{connectionId}")
    @Operation(summary = "Failure state of a connection")
    public Mono<ResponseEntity<Map<String, Object>>> getAlertStatus(@PathVariable UUID connectionId) {
        return escalationService.getAlertStatus(connectionId)
                .map(alert -> ResponseEntity.ok(toResponse(alert)));
    }

    @PostMapping("/{connectionId}/acknowledge")
    @Operation(summary = "Acknowledge an alert until the next failure")
    public Mono<ResponseEntity<Map<String, Object>>> acknowledgeAlert(
            @PathVariable UUID connectionId,
            @Valid @RequestBody(required = false) AcknowledgeAlertRequest request) {

        Mono<String> user = request != null && request.getAcknowledgedBy() != null && !request.getAcknowledgedBy().isBlank()
                ? Mono.just(request.getAcknowledgedBy())
                : ReactiveSecurityContextHolder.getContext()
                        .mapNotNull(context -> context.getAuthentication() != null ? context.getAuthentication().getName() : null)
                        .defaultIfEmpty("unknown");

        return user.flatMap(name -> escalationService.acknowledgeAlert(connectionId, name))
                .map(alert -> ResponseEntity.ok(toResponse(alert)));
    }

    private Map<String, Object> toResponse(SyncFailureAlert alert) {
        Map<String, Object> response = new HashMap<>();
        response.put("connectionId", alert.getConnectionId());
        response.put("consecutiveFailures", alert.getConsecutiveFailures());
        response.put("lastFailureAt", alert.getLastFailureAt());
        response.put("lastAlertSentAt", alert.getLastAlertSentAt());
        response.put("acknowledged", alert.isAcknowledged());
        response.put("acknowledgedAt", alert.getAcknowledgedAt());
        response.put("acknowledgedBy", alert.getAcknowledgedBy());
        response.put("failureDetails", escalationService.getFailureDetails(alert));
        return response;
    }
}
