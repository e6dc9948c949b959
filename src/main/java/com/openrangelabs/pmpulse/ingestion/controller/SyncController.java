package com.openrangelabs.pmpulse.ingestion.controller;

import com.openrangelabs.pmpulse.ingestion.dto.TriggerSyncRequest;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.model.ResourceError;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.scheduler.SchedulingPolicy;
import com.openrangelabs.pmpulse.ingestion.service.SyncRunService;
import com.openrangelabs.pmpulse.ingestion.service.SyncTriggerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for sync runs: trigger, history and schedule
 */
@RestController
@RequestMapping("/api/sync")
@Tag(name = "Sync", description = "Sync run operations")
public class SyncController {

    static final String DEFAULT_TRIGGERED_BY = "api";

    private final SyncTriggerService triggerService;
    private final SyncRunService runService;
    private final SchedulingPolicy schedulingPolicy;

    @Autowired
    public SyncController(SyncTriggerService triggerService, SyncRunService runService,
                          SchedulingPolicy schedulingPolicy) {
        this.triggerService = triggerService;
        this.runService = runService;
        this.schedulingPolicy = schedulingPolicy;
    }

    /**
     * Start a sync for a connection and answer 202 with the accepted run. The run continues
     * after the response; poll {@code /runs/{runId}} for its outcome.
     * Responds 409 while another run of the connection is active, unless {@code force} is set.
     */
    @PostMapping("/{connectionId}")
    @Operation(summary = "Trigger a sync run")
    public Mono<ResponseEntity<Map<String, Object>>> triggerSync(
            @PathVariable UUID connectionId,
            @Valid @RequestBody(required = false) TriggerSyncRequest request) {

        TriggerSyncRequest effective = request != null ? request : new TriggerSyncRequest();
        return currentUser()
                .flatMap(user -> triggerService.submitSync(connectionId, effective.getSyncMode(),
                        effective.isForce(), user))
                .map(run -> ResponseEntity.status(HttpStatus.ACCEPTED).body(toSummary(run)));
    }

    @GetMapping("/runs/{runId}")
    @Operation(summary = "Get a run with its per-resource metrics and errors")
    public Mono<ResponseEntity<Map<String, Object>>> getRun(@PathVariable UUID runId) {
        return runService.getRunWithDetails(runId)
                .map(run -> ResponseEntity.ok(toResponse(run)))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/connections/{connectionId}/runs")
    @Operation(summary = "List recent runs of a connection")
    public Mono<ResponseEntity<Map<String, Object>>> getRuns(
            @PathVariable UUID connectionId,
            @RequestParam(defaultValue = "20") int limit) {

        return runService.getRunsForConnection(connectionId)
                .take(Math.max(1, Math.min(limit, 200)))
                .map(SyncController::toSummary)
                .collectList()
                .map(runs -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("connectionId", connectionId);
                    response.put("runs", runs);
                    response.put("count", runs.size());
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.ok(response);
                });
    }

    @GetMapping("/schedule")
    @Operation(summary = "Current polling schedule")
    public Mono<ResponseEntity<Map<String, Object>>> getSchedule() {
        return Mono.fromSupplier(() -> ResponseEntity.ok(schedulingPolicy.getConfiguration()));
    }

    private Mono<String> currentUser() {
        return ReactiveSecurityContextHolder.getContext()
                .mapNotNull(context -> context.getAuthentication() != null ? context.getAuthentication().getName() : null)
                .defaultIfEmpty(DEFAULT_TRIGGERED_BY);
    }

    static Map<String, Object> toSummary(SyncRun run) {
        Map<String, Object> summary = new HashMap<>();
        summary.put("id", run.getId());
        summary.put("connectionId", run.getConnectionId());
        summary.put("mode", run.getMode());
        summary.put("status", run.getRunStatus().name().toLowerCase());
        summary.put("startedAt", run.getStartedAt());
        summary.put("endedAt", run.getEndedAt());
        summary.put("resourcesSynced", run.getResourcesSynced());
        summary.put("errorsCount", run.getErrorsCount());
        summary.put("errorSummary", run.getErrorSummary());
        summary.put("triggeredBy", run.getTriggeredBy());
        return summary;
    }

    static Map<String, Object> toResponse(SyncRun run) {
        Map<String, Object> response = toSummary(run);

        Map<String, Object> resources = new LinkedHashMap<>();
        run.getResourceMetrics().forEach((type, metrics) -> resources.put(type.getKey(), toMetrics(metrics)));
        response.put("resources", resources);

        Map<String, Object> errors = new LinkedHashMap<>();
        run.getResourceErrors().forEach((type, list) -> errors.put(type.getKey(), toErrors(list)));
        response.put("errors", errors);
        return response;
    }

    private static Map<String, Object> toMetrics(ResourceMetrics metrics) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("created", metrics.created());
        values.put("updated", metrics.updated());
        values.put("skipped", metrics.skipped());
        values.put("errors", metrics.errors());
        values.put("durationMs", metrics.durationMs());
        return values;
    }

    private static List<Map<String, Object>> toErrors(List<ResourceError> errors) {
        return errors.stream()
                .map(error -> {
                    Map<String, Object> values = new LinkedHashMap<>();
                    values.put("message", error.message());
                    values.put("context", error.context());
                    values.put("occurredAt", error.occurredAt());
                    return values;
                })
                .toList();
    }
}
