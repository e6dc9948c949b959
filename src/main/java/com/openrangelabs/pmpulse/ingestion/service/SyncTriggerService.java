package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.exception.ConnectionNotConfiguredException;
import com.openrangelabs.pmpulse.ingestion.exception.SyncAlreadyRunningException;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Entry point for starting a sync on a connection, used by the REST API and the scheduler.
 * At most one run per connection proceeds at a time.
 */
@Service
public class SyncTriggerService {

    private static final Logger logger = LoggerFactory.getLogger(SyncTriggerService.class);

    private final ConnectionService connectionService;
    private final SyncRunService runService;
    private final SyncLockService lockService;
    private final IngestionOrchestrator orchestrator;
    private final IngestionProperties properties;

    @Autowired
    public SyncTriggerService(
            ConnectionService connectionService,
            SyncRunService runService,
            SyncLockService lockService,
            IngestionOrchestrator orchestrator,
            IngestionProperties properties) {
        this.connectionService = connectionService;
        this.runService = runService;
        this.lockService = lockService;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    /**
     * Run a sync and wait for the finished run. Refused while another run of the connection is
     * active, unless forced. Cancelling the returned {@link Mono} does not stop the run.
     */
    public Mono<SyncRun> triggerSync(UUID connectionId, SyncMode mode, boolean force, String triggeredBy) {
        return acceptSync(connectionId, mode, force, triggeredBy)
                .flatMap(AcceptedRun::outcome);
    }

    /**
     * Start a sync in the background and return the pending run as soon as it is created.
     */
    public Mono<SyncRun> submitSync(UUID connectionId, SyncMode mode, boolean force, String triggeredBy) {
        return acceptSync(connectionId, mode, force, triggeredBy)
                .map(AcceptedRun::run);
    }

    private Mono<AcceptedRun> acceptSync(UUID connectionId, SyncMode mode, boolean force, String triggeredBy) {
        return connectionService.getConnection(connectionId)
                .flatMap(connection -> {
                    if (!connection.isConfigured()) {
                        return Mono.error(new ConnectionNotConfiguredException(connectionId));
                    }
                    return checkNoActiveRun(connectionId, force)
                            .then(lockAndCreateRun(connection, mode, force, triggeredBy));
                });
    }

    private Mono<Void> checkNoActiveRun(UUID connectionId, boolean force) {
        if (force) {
            return Mono.empty();
        }
        return runService.getActiveRuns(connectionId, properties.sync().staleRunTimeout())
                .next()
                .flatMap(active -> {
                    logger.warn("Sync already running for connection {} (run {})", connectionId, active.getId());
                    return Mono.<Void>error(new SyncAlreadyRunningException(connectionId));
                });
    }

    private Mono<AcceptedRun> lockAndCreateRun(ApiConnection connection, SyncMode mode, boolean force,
                                               String triggeredBy) {
        UUID connectionId = connection.getId();
        String owner = UUID.randomUUID().toString();

        return lockService.acquire(connectionId, owner, force)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return Mono.error(new SyncAlreadyRunningException(connectionId));
                    }
                    return runService.createRun(connectionId, mode, triggeredBy)
                            .onErrorResume(error -> lockService.release(connectionId, owner)
                                    .then(Mono.error(error)))
                            .map(run -> new AcceptedRun(run, runDetached(run, connection, owner)));
                });
    }

    /**
     * Subscribe to the run independently of the caller, so it always reaches completed or failed
     * and the lock is released. The returned {@link Mono} replays the outcome.
     */
    private Mono<SyncRun> runDetached(SyncRun run, ApiConnection connection, String owner) {
        Sinks.One<SyncRun> outcome = Sinks.one();
        Mono.usingWhen(
                        Mono.just(owner),
                        lockOwner -> execute(run, connection),
                        lockOwner -> lockService.release(connection.getId(), lockOwner))
                .subscribe(
                        finished -> {
                            logger.info("Sync run {} finished as {}", finished.getId(), finished.getStatus().toLowerCase());
                            outcome.tryEmitValue(finished);
                        },
                        error -> {
                            logger.error("Sync run {} ended with an error: {}", run.getId(), error.getMessage(), error);
                            outcome.tryEmitError(error);
                        },
                        outcome::tryEmitEmpty);
        return outcome.asMono();
    }

    private Mono<SyncRun> execute(SyncRun run, ApiConnection connection) {
        return orchestrator.startSync(run, connection)
                .flatMap(session -> orchestrator.processAll(session)
                        .then(Mono.defer(() -> orchestrator.completeSync(session)))
                        .onErrorResume(error -> session.getRun().isTerminal()
                                ? Mono.error(error)
                                : orchestrator.failSync(session, error)));
    }

    private record AcceptedRun(SyncRun run, Mono<SyncRun> outcome) {
    }
}
