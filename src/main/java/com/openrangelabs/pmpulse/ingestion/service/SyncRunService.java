package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.entity.SyncResourceMetric;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRunError;
import com.openrangelabs.pmpulse.ingestion.model.BatchResult;
import com.openrangelabs.pmpulse.ingestion.model.ResourceError;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import com.openrangelabs.pmpulse.ingestion.repository.RawEventRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncResourceMetricRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncRunErrorRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for managing sync runs and their per-resource details
 */
@Service
public class SyncRunService {

    private static final Logger logger = LoggerFactory.getLogger(SyncRunService.class);

    private final SyncRunRepository repository;
    private final SyncResourceMetricRepository metricRepository;
    private final SyncRunErrorRepository errorRepository;
    private final RawEventRepository rawEventRepository;
    private final Clock clock;

    @Autowired
    public SyncRunService(SyncRunRepository repository, SyncResourceMetricRepository metricRepository,
                          SyncRunErrorRepository errorRepository, RawEventRepository rawEventRepository,
                          Clock clock) {
        this.repository = repository;
        this.metricRepository = metricRepository;
        this.errorRepository = errorRepository;
        this.rawEventRepository = rawEventRepository;
        this.clock = clock;
    }

    /**
     * Create a pending run
     */
    public Mono<SyncRun> createRun(UUID connectionId, SyncMode mode, String triggeredBy) {
        SyncRun run = new SyncRun(connectionId, mode, triggeredBy);
        run.setCreatedAt(LocalDateTime.now(clock));
        return repository.save(run)
                .doOnSuccess(saved -> logger.info("Created {} sync run {} for connection {}",
                        mode.getValue(), saved.getId(), connectionId));
    }

    public Mono<SyncRun> saveRun(SyncRun run) {
        return repository.save(run);
    }

    /**
     * Persist the run row together with its resource metrics and errors
     */
    @Transactional
    public Mono<SyncRun> saveRunWithDetails(SyncRun run) {
        List<SyncResourceMetric> metricRows = new ArrayList<>();
        run.getResourceMetrics().forEach((type, metrics) -> metricRows.add(SyncResourceMetric.of(run.getId(), type, metrics)));

        List<SyncRunError> errorRows = new ArrayList<>();
        run.getResourceErrors().forEach((type, errors) -> {
            for (ResourceError error : errors) {
                errorRows.add(SyncRunError.of(run.getId(), type, error));
            }
        });

        return repository.save(run)
                .flatMap(saved -> metricRepository.saveAll(metricRows)
                        .thenMany(errorRepository.saveAll(errorRows))
                        .then(Mono.just(saved)))
                .doOnSuccess(saved -> logger.debug("Saved run {} with {} metric rows and {} error rows",
                        run.getId(), metricRows.size(), errorRows.size()));
    }

    public Mono<SyncRun> getRun(UUID runId) {
        return repository.findById(runId);
    }

    /**
     * Load a run with its persisted resource metrics and errors attached
     */
    public Mono<SyncRun> getRunWithDetails(UUID runId) {
        return repository.findById(runId)
                .flatMap(run -> metricRepository.findBySyncRunId(runId)
                        .doOnNext(row -> run.restoreResourceMetrics(row.getResourceTypeEnum(), row.toMetrics()))
                        .thenMany(errorRepository.findBySyncRunIdOrderByOccurredAtAsc(runId))
                        .doOnNext(row -> run.addResourceError(row.getResourceTypeEnum(), row.toResourceError()))
                        .then(Mono.just(run)));
    }

    public Flux<SyncRun> getRunsForConnection(UUID connectionId) {
        return repository.findByConnectionIdOrderByCreatedAtDesc(connectionId);
    }

    public Mono<SyncRun> getLatestRun(UUID connectionId) {
        return repository.findLatest(connectionId);
    }

    public Mono<SyncRun> getLatestCompletedRun(UUID connectionId) {
        return repository.findLatestCompleted(connectionId);
    }

    /**
     * Running runs of a connection started within the stale timeout. Older running rows are treated as abandoned.
     */
    public Flux<SyncRun> getActiveRuns(UUID connectionId, Duration staleRunTimeout) {
        LocalDateTime startedAfter = LocalDateTime.now(clock).minus(staleRunTimeout);
        return repository.findActiveRuns(connectionId, startedAfter);
    }

    /**
     * Delete up to {@code limit} terminal runs that ended more than {@code retentionDays} ago,
     * with their raw events, metrics and errors
     */
    @Transactional
    public Mono<BatchResult> purgeExpiredRuns(int retentionDays, int limit) {
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(retentionDays);
        return repository.findExpiredRunIds(threshold, limit)
                .collectList()
                .flatMap(ids -> {
                    if (ids.isEmpty()) {
                        return Mono.just(BatchResult.empty());
                    }
                    return rawEventRepository.deleteBySyncRunIdIn(ids)
                            .then(metricRepository.deleteBySyncRunIdIn(ids))
                            .then(errorRepository.deleteBySyncRunIdIn(ids))
                            .then(repository.deleteByIdIn(ids))
                            .map(deleted -> new BatchResult(deleted, ids.size() >= limit));
                })
                .doOnSuccess(result -> logger.info("Purged {} sync runs older than {} days (more remaining: {})",
                        result.processed(), retentionDays, result.moreRemaining()));
    }
}
