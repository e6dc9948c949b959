package com.openrangelabs.pmpulse.ingestion.scheduler;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.exception.SyncAlreadyRunningException;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import com.openrangelabs.pmpulse.ingestion.service.ConnectionService;
import com.openrangelabs.pmpulse.ingestion.service.SyncRunService;
import com.openrangelabs.pmpulse.ingestion.service.SyncTriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Scheduler for automated sync and retention tasks
 */
@Component
public class IngestionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IngestionScheduler.class);

    static final String TRIGGERED_BY = "scheduler";
    static final Duration RETENTION_FOLLOW_UP_DELAY = Duration.ofSeconds(30);

    private final SchedulingPolicy schedulingPolicy;
    private final SyncTriggerService triggerService;
    private final ConnectionService connectionService;
    private final SyncRunService runService;
    private final TaskScheduler taskScheduler;
    private final IngestionProperties properties;
    private final Clock clock;

    @Autowired
    public IngestionScheduler(
            SchedulingPolicy schedulingPolicy,
            SyncTriggerService triggerService,
            ConnectionService connectionService,
            SyncRunService runService,
            TaskScheduler taskScheduler,
            IngestionProperties properties,
            Clock clock) {
        this.schedulingPolicy = schedulingPolicy;
        this.triggerService = triggerService;
        this.connectionService = connectionService;
        this.runService = runService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Every minute: start an incremental sync per configured connection when the policy says so
     */
    @Scheduled(cron = "0 * * * * *")
    public void scheduledIncrementalSync() {
        if (!properties.scheduling().enabled()) {
            logger.debug("Scheduled sync is disabled");
            return;
        }
        if (!schedulingPolicy.shouldSyncNow()) {
            logger.trace("Not a sync boundary ({})", schedulingPolicy.getSyncModeDescription());
            return;
        }

        logger.info("Starting scheduled incremental sync: {}", schedulingPolicy.getSyncModeDescription());
        syncAllConnections(SyncMode.INCREMENTAL)
                .subscribe(
                        count -> logger.debug("Scheduled incremental sync finished for {} connections", count),
                        error -> logger.error("Error during scheduled incremental sync: {}", error.getMessage()));
    }

    /**
     * Daily full sync
     */
    @Scheduled(cron = "${pmpulse.scheduling.full-sync-cron:0 0 2 * * *}")
    public void scheduledFullSync() {
        if (!properties.scheduling().enabled()) {
            logger.debug("Scheduled sync is disabled");
            return;
        }

        logger.info("Starting scheduled full sync");
        syncAllConnections(SyncMode.FULL)
                .subscribe(
                        count -> logger.info("Scheduled full sync finished for {} connections", count),
                        error -> logger.error("Error during scheduled full sync: {}", error.getMessage()));
    }

    /**
     * Purge expired runs daily at 3 AM, one bounded batch at a time
     */
    @Scheduled(cron = "0 0 3 * * *")
    public void cleanupExpiredRuns() {
        if (!properties.retention().enabled()) {
            logger.debug("Run retention is disabled");
            return;
        }

        logger.info("Starting purge of sync runs older than {} days", properties.retention().retentionDays());
        runRetentionBatch();
    }

    /**
     * Purge one batch and enqueue a follow-up when more expired runs remain
     */
    void runRetentionBatch() {
        runService.purgeExpiredRuns(properties.retention().retentionDays(), properties.retention().batchSize())
                .subscribe(
                        result -> {
                            if (result.moreRemaining()) {
                                logger.info("Purged {} runs, more remain; scheduling follow-up batch", result.processed());
                                taskScheduler.schedule(this::runRetentionBatch,
                                        clock.instant().plus(RETENTION_FOLLOW_UP_DELAY));
                            }
                        },
                        error -> logger.error("Error during run retention: {}", error.getMessage()));
    }

    Mono<Long> syncAllConnections(SyncMode mode) {
        return connectionService.getConfiguredConnections()
                .concatMap(connection -> triggerService.triggerSync(connection.getId(), mode, false, TRIGGERED_BY)
                        .doOnSuccess(run -> logger.info("Scheduled {} sync for connection {} finished as {}",
                                mode.getValue(), connection.getName(), run.getStatus()))
                        .onErrorResume(SyncAlreadyRunningException.class, error -> {
                            logger.info("Skipping connection {}: {}", connection.getName(), error.getMessage());
                            return Mono.empty();
                        })
                        .onErrorResume(error -> {
                            logger.error("Scheduled {} sync failed for connection {}: {}",
                                    mode.getValue(), connection.getName(), error.getMessage());
                            return Mono.empty();
                        }))
                .count();
    }
}
