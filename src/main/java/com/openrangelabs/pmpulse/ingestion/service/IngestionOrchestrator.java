package com.openrangelabs.pmpulse.ingestion.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.client.RemoteApiClient;
import com.openrangelabs.pmpulse.ingestion.client.RemoteApiClientFactory;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.entity.RawEvent;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.exception.RecordMappingException;
import com.openrangelabs.pmpulse.ingestion.exception.RemoteApiException;
import com.openrangelabs.pmpulse.ingestion.exception.UnresolvedReferenceException;
import com.openrangelabs.pmpulse.ingestion.handler.RecordValues;
import com.openrangelabs.pmpulse.ingestion.handler.ResourceHandler;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import com.openrangelabs.pmpulse.ingestion.model.UpsertResult;
import com.openrangelabs.pmpulse.ingestion.repository.RawEventRepository;
import com.openrangelabs.pmpulse.ingestion.sync.ResourceSyncTracker;
import com.openrangelabs.pmpulse.ingestion.sync.SyncSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one sync run: start, process every configured resource in dependency order, complete.
 *
 * <p>Each fetched record is stored as a raw event first, then mapped and upserted by its handler.
 * Record-level problems are counted and processing moves on. A remote failure aborts only the
 * current resource. The run fails when any resource was aborted, and the finished run is always
 * handed to {@link FailureEscalationService}.
 */
@Service
public class IngestionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionOrchestrator.class);

    static final int ERROR_SUMMARY_LIMIT = 10;

    private final Map<ResourceType, ResourceHandler> handlers;
    private final SyncRunService runService;
    private final RawEventRepository rawEventRepository;
    private final ConnectionService connectionService;
    private final RemoteApiClientFactory clientFactory;
    private final FailureEscalationService escalationService;
    private final IngestionProperties properties;
    private final Clock clock;

    @Autowired
    public IngestionOrchestrator(
            List<ResourceHandler> handlerList,
            SyncRunService runService,
            RawEventRepository rawEventRepository,
            ConnectionService connectionService,
            RemoteApiClientFactory clientFactory,
            FailureEscalationService escalationService,
            IngestionProperties properties,
            Clock clock) {

        this.handlers = handlerList.stream()
                .collect(Collectors.toMap(ResourceHandler::getResourceType, Function.identity(),
                        (first, second) -> {
                            throw new IllegalStateException("Duplicate handler for " + first.getResourceType());
                        },
                        () -> new EnumMap<>(ResourceType.class)));
        this.runService = runService;
        this.rawEventRepository = rawEventRepository;
        this.connectionService = connectionService;
        this.clientFactory = clientFactory;
        this.escalationService = escalationService;
        this.properties = properties;
        this.clock = clock;

        logger.info("Initialized ingestion orchestrator with handlers: {}", handlers.keySet());
    }

    /**
     * Move a pending run to running and open its session. A run can only be started once.
     */
    public Mono<SyncSession> startSync(SyncRun run, ApiConnection connection) {
        return Mono.fromRunnable(() -> run.start(LocalDateTime.now(clock)))
                .then(resolveModifiedSince(run))
                .flatMap(modifiedSince -> runService.saveRun(run)
                        .map(saved -> {
                            RemoteApiClient client = clientFactory.create(connection);
                            logger.info("Started {} sync run {} for connection {}{}", run.getMode(), run.getId(),
                                    connection.getName(),
                                    modifiedSince.map(since -> " (modified since " + since + ")").orElse(""));
                            return new SyncSession(saved, connection, client, properties, clock, modifiedSince.orElse(null));
                        }));
    }

    /**
     * Page through one resource and upsert every record
     */
    public Mono<ResourceMetrics> processResource(SyncSession session, ResourceType type) {
        ResourceHandler handler = handlers.get(type);
        if (handler == null) {
            return Mono.error(new IllegalArgumentException("No handler registered for resource type: " + type.getKey()));
        }

        return Mono.defer(() -> {
            ResourceSyncTracker tracker = session.openTracker(type);
            logger.info("Processing {} for run {}", type.getKey(), session.getRun().getId());

            return session.getClient().fetchAll(type, buildParams(session, type))
                    .concatMap(record -> processRecord(session, handler, tracker, record))
                    .then(Mono.defer(() -> handler.afterResource(session)))
                    .onErrorResume(error -> {
                        recordResourceFailure(tracker, type, error);
                        return Mono.empty();
                    })
                    .then(Mono.fromCallable(tracker::finish));
        });
    }

    /**
     * Process every configured resource type in dependency order, one at a time
     */
    public Mono<Map<ResourceType, ResourceMetrics>> processAll(SyncSession session) {
        List<ResourceType> types = ResourceType.inProcessingOrder(properties.sync().resources());
        return Flux.fromIterable(types)
                .concatMap(type -> processResource(session, type).map(metrics -> Map.entry(type, metrics)))
                .collect(() -> new EnumMap<>(ResourceType.class), (map, entry) -> map.put(entry.getKey(), entry.getValue()));
    }

    /**
     * Finalize open trackers, settle the run status, persist the run and report it for escalation
     */
    public Mono<SyncRun> completeSync(SyncSession session) {
        return Mono.defer(() -> {
            SyncRun run = session.getRun();
            session.getTrackers().stream()
                    .filter(tracker -> !tracker.isFinished())
                    .forEach(ResourceSyncTracker::finish);

            int processed = session.getTrackers().stream().mapToInt(ResourceSyncTracker::getProcessedCount).sum();
            int errors = run.getTotalErrorCount();
            run.setResourcesSynced(processed);
            run.setErrorsCount(errors);

            String summary = buildErrorSummary(session);
            boolean aborted = session.getTrackers().stream().anyMatch(ResourceSyncTracker::isFailed);
            if (aborted) {
                run.fail(summary, LocalDateTime.now(clock));
            } else {
                run.complete(LocalDateTime.now(clock));
                run.setErrorSummary(summary);
            }

            logger.info("Sync run {} {}: processed={}, errors={}", run.getId(),
                    run.getStatus().toLowerCase(), processed, errors);
            return finish(session, summary);
        });
    }

    /**
     * Fail a run on an unexpected error outside record and resource processing
     */
    public Mono<SyncRun> failSync(SyncSession session, Throwable error) {
        return Mono.defer(() -> {
            SyncRun run = session.getRun();
            session.getTrackers().stream()
                    .filter(tracker -> !tracker.isFinished())
                    .forEach(ResourceSyncTracker::finish);
            String message = "Sync failed: " + describe(error);
            run.setResourcesSynced(session.getTrackers().stream().mapToInt(ResourceSyncTracker::getProcessedCount).sum());
            run.setErrorsCount(run.getTotalErrorCount());
            run.fail(message, LocalDateTime.now(clock));
            logger.error("Sync run {} failed: {}", run.getId(), message, error);
            return finish(session, message);
        });
    }

    public Optional<ResourceHandler> getHandler(ResourceType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    private Mono<SyncRun> finish(SyncSession session, String summary) {
        SyncRun run = session.getRun();
        ApiConnection connection = session.getConnection();
        Mono<ApiConnection> connectionUpdate = Mono.defer(() -> run.isCompleted()
                ? connectionService.markSuccess(connection)
                : connectionService.markError(connection, summary));

        return runService.saveRunWithDetails(run)
                .flatMap(saved -> connectionUpdate
                        .then(escalationService.handleSyncCompleted(saved))
                        .thenReturn(saved));
    }

    private Mono<Void> processRecord(SyncSession session, ResourceHandler handler, ResourceSyncTracker tracker,
                                     JsonNode record) {
        ResourceType type = handler.getResourceType();
        String externalId = externalIdOf(type, record);
        RawEvent event = new RawEvent(session.getRun().getId(), type.getKey(), externalId, record.toString());

        return rawEventRepository.save(event)
                .then(Mono.defer(() -> externalId == null
                        ? Mono.<UpsertResult>error(new RecordMappingException(
                                "Record has no " + type.getExternalIdField()))
                        : handler.upsert(externalId, record)))
                .doOnNext(result -> {
                    if (result == UpsertResult.CREATED) {
                        tracker.recordCreated();
                    } else {
                        tracker.recordUpdated();
                    }
                })
                .then()
                .onErrorResume(UnresolvedReferenceException.class, error -> {
                    tracker.recordSkipped(externalId + ": " + error.getMessage());
                    return Mono.empty();
                })
                .onErrorResume(error -> {
                    tracker.recordError(describe(error), recordContext(type, externalId));
                    return Mono.empty();
                });
    }

    private void recordResourceFailure(ResourceSyncTracker tracker, ResourceType type, Throwable error) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("resource", type.getKey());
        if (error instanceof RemoteApiException apiError) {
            context.put("status", String.valueOf(apiError.getStatusCode()));
        } else {
            logger.error("Unexpected error while processing {}", type.getKey(), error);
        }
        tracker.recordFailure("Failed to fetch " + type.getKey() + ": " + describe(error), context);
    }

    Map<String, String> buildParams(SyncSession session, ResourceType type) {
        Map<String, String> params = new LinkedHashMap<>();
        if (session.getModifiedSince() != null) {
            params.put("modified_since", session.getModifiedSince().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        } else if (type.isDateRanged()) {
            LocalDate today = LocalDate.now(clock);
            params.put("from_date", today.minusDays(properties.sync().fullSyncLookbackDays()).toString());
            params.put("to_date", today.toString());
        }
        return params;
    }

    private Mono<Optional<LocalDateTime>> resolveModifiedSince(SyncRun run) {
        if (run.getSyncMode() != SyncMode.INCREMENTAL) {
            return Mono.just(Optional.empty());
        }
        LocalDateTime fallback = LocalDateTime.now(clock).minusDays(properties.sync().incrementalDays());
        return runService.getLatestCompletedRun(run.getConnectionId())
                .mapNotNull(SyncRun::getEndedAt)
                .defaultIfEmpty(fallback)
                .map(Optional::of);
    }

    private String buildErrorSummary(SyncSession session) {
        List<String> lines = new ArrayList<>();
        for (ResourceSyncTracker tracker : session.getTrackers()) {
            if (tracker.isFailed()) {
                lines.add(tracker.getResourceType().getKey() + ": " + tracker.getFailureMessage());
            }
        }
        for (ResourceSyncTracker tracker : session.getTrackers()) {
            for (String message : tracker.getErrorMessages()) {
                if (!message.equals(tracker.getFailureMessage())) {
                    lines.add(tracker.getResourceType().getKey() + ": " + message);
                }
            }
        }
        if (lines.isEmpty()) {
            return null;
        }

        String summary = String.join("\n", lines.subList(0, Math.min(ERROR_SUMMARY_LIMIT, lines.size())));
        if (lines.size() > ERROR_SUMMARY_LIMIT) {
            summary += "\n... and " + (lines.size() - ERROR_SUMMARY_LIMIT) + " more errors";
        }
        return summary;
    }

    static String externalIdOf(ResourceType type, JsonNode record) {
        String id = RecordValues.text(record, type.getExternalIdField());
        return id != null ? id : RecordValues.text(record, "id");
    }

    private static Map<String, String> recordContext(ResourceType type, String externalId) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("resource", type.getKey());
        context.put("item_id", externalId != null ? externalId : "(missing)");
        return context;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
