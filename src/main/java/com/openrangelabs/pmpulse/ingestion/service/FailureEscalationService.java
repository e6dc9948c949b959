package com.openrangelabs.pmpulse.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.SyncFailureAlert;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.exception.AlertNotFoundException;
import com.openrangelabs.pmpulse.ingestion.model.FailureDetail;
import com.openrangelabs.pmpulse.ingestion.notification.AlertMessage;
import com.openrangelabs.pmpulse.ingestion.notification.AlertNotifier;
import com.openrangelabs.pmpulse.ingestion.repository.SyncFailureAlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Tracks consecutive run failures per connection and decides when a human is notified.
 *
 * <p>A failed run increments the counter and clears any acknowledgment. Once the counter reaches
 * the configured threshold an alert goes out, at most once per cooldown window and never while
 * acknowledged. A completed run resets the counter and leaves acknowledgment untouched.
 */
@Service
public class FailureEscalationService {

    private static final Logger logger = LoggerFactory.getLogger(FailureEscalationService.class);

    private static final TypeReference<List<FailureDetail>> DETAILS_TYPE = new TypeReference<>() {};

    private final SyncFailureAlertRepository repository;
    private final List<AlertNotifier> notifiers;
    private final ObjectMapper objectMapper;
    private final IngestionProperties.Alerts alertSettings;
    private final IngestionProperties.Features features;
    private final Clock clock;

    @Autowired
    public FailureEscalationService(SyncFailureAlertRepository repository, List<AlertNotifier> notifiers,
                                    ObjectMapper objectMapper, IngestionProperties properties, Clock clock) {
        this.repository = repository;
        this.notifiers = notifiers;
        this.objectMapper = objectMapper;
        this.alertSettings = properties.alerts();
        this.features = properties.features();
        this.clock = clock;
    }

    /**
     * Update the failure state of the run's connection from a finished run
     */
    @Transactional
    public Mono<SyncFailureAlert> handleSyncCompleted(SyncRun run) {
        if (!run.isTerminal()) {
            return Mono.error(new IllegalArgumentException("Sync run " + run.getId() + " has not finished"));
        }

        return findOrCreate(run.getConnectionId())
                .flatMap(alert -> run.isCompleted() ? reset(alert) : recordFailure(alert, run));
    }

    /**
     * Suppress further alerts until the next failure. The failure counter is kept.
     */
    public Mono<SyncFailureAlert> acknowledgeAlert(UUID connectionId, String user) {
        return repository.findByConnectionId(connectionId)
                .switchIfEmpty(Mono.error(new AlertNotFoundException(connectionId)))
                .flatMap(alert -> {
                    alert.acknowledge(user, now());
                    return repository.save(alert);
                })
                .doOnSuccess(alert -> logger.info("Alert for connection {} acknowledged by {}", connectionId, user));
    }

    /**
     * Current failure state of a connection. Connections that never failed report zero failures.
     */
    public Mono<SyncFailureAlert> getAlertStatus(UUID connectionId) {
        return repository.findByConnectionId(connectionId)
                .defaultIfEmpty(new SyncFailureAlert(connectionId));
    }

    public Flux<SyncFailureAlert> getActiveAlerts() {
        return repository.findActive(alertSettings.failureThreshold());
    }

    public Mono<SyncFailureAlert> resetFailures(UUID connectionId) {
        return repository.findByConnectionId(connectionId)
                .switchIfEmpty(Mono.error(new AlertNotFoundException(connectionId)))
                .flatMap(this::reset);
    }

    /**
     * Recent failure contexts of an alert, oldest first
     */
    public List<FailureDetail> getFailureDetails(SyncFailureAlert alert) {
        String json = alert.getFailureDetails();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, DETAILS_TYPE));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable failure details for connection {}: {}",
                    alert.getConnectionId(), e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    private Mono<SyncFailureAlert> findOrCreate(UUID connectionId) {
        return repository.findByConnectionId(connectionId)
                .switchIfEmpty(Mono.fromSupplier(() -> new SyncFailureAlert(connectionId)));
    }

    private Mono<SyncFailureAlert> reset(SyncFailureAlert alert) {
        if (alert.getId() != null && !alert.hasFailures()) {
            return Mono.just(alert);
        }
        int previous = alert.getConsecutiveFailures();
        alert.resetFailures(now());
        return repository.save(alert)
                .doOnSuccess(saved -> {
                    if (previous > 0) {
                        logger.info("Connection {} recovered after {} consecutive failures",
                                saved.getConnectionId(), previous);
                    }
                });
    }

    private Mono<SyncFailureAlert> recordFailure(SyncFailureAlert alert, SyncRun run) {
        LocalDateTime now = now();
        List<FailureDetail> details = getFailureDetails(alert);
        details.add(FailureDetail.of(run, now));
        int overflow = details.size() - alertSettings.maxFailureDetails();
        if (overflow > 0) {
            details.subList(0, overflow).clear();
        }

        alert.recordFailure(now, writeDetails(details));
        logger.warn("Connection {} has {} consecutive sync failures (run {})",
                alert.getConnectionId(), alert.getConsecutiveFailures(), run.getId());

        return repository.save(alert)
                .flatMap(saved -> evaluate(saved, run, details));
    }

    private Mono<SyncFailureAlert> evaluate(SyncFailureAlert alert, SyncRun run, List<FailureDetail> details) {
        if (!features.notifications()) {
            logger.debug("Notifications disabled, no alert for connection {}", alert.getConnectionId());
            return Mono.just(alert);
        }
        if (alert.getConsecutiveFailures() < alertSettings.failureThreshold()) {
            return Mono.just(alert);
        }
        if (!alert.isAlertDue(now(), alertSettings.cooldownMinutes())) {
            logger.info("Alert for connection {} suppressed (acknowledged or within {} minute cooldown)",
                    alert.getConnectionId(), alertSettings.cooldownMinutes());
            return Mono.just(alert);
        }
        return sendAlert(alert, run, details);
    }

    private Mono<SyncFailureAlert> sendAlert(SyncFailureAlert alert, SyncRun run, List<FailureDetail> details) {
        AlertMessage message = AlertMessage.forFailures(alert, run, details, alertSettings.recipients());

        return Flux.fromIterable(notifiers)
                .filter(AlertNotifier::isEnabled)
                .concatMap(notifier -> notifier.send(message)
                        .onErrorResume(error -> {
                            logger.error("Failed to send alert through {} for connection {}: {}",
                                    notifier.getChannel(), alert.getConnectionId(), error.getMessage());
                            return Mono.empty();
                        }))
                .then(Mono.defer(() -> {
                    alert.markAlertSent(now());
                    return repository.save(alert);
                }))
                .doOnSuccess(saved -> logger.warn("Sent failure alert for connection {}: {}",
                        saved.getConnectionId(), message.subject()));
    }

    private String writeDetails(List<FailureDetail> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize failure details", e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
