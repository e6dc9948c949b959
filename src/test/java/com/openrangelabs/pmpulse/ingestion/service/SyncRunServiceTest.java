package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.entity.RawEvent;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.model.ResourceError;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import com.openrangelabs.pmpulse.ingestion.repository.ApiConnectionRepository;
import com.openrangelabs.pmpulse.ingestion.repository.RawEventRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncFailureAlertRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncResourceMetricRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncRunErrorRepository;
import com.openrangelabs.pmpulse.ingestion.repository.SyncRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataR2dbcTest
@ActiveProfiles("test")
class SyncRunServiceTest {

    @Autowired
    private SyncRunRepository runRepository;

    @Autowired
    private SyncResourceMetricRepository metricRepository;

    @Autowired
    private SyncRunErrorRepository errorRepository;

    @Autowired
    private RawEventRepository rawEventRepository;

    @Autowired
    private SyncFailureAlertRepository alertRepository;

    @Autowired
    private ApiConnectionRepository connectionRepository;

    private SyncRunService runService;
    private UUID connectionId;

    @BeforeEach
    void setUp() {
        rawEventRepository.deleteAll()
                .then(errorRepository.deleteAll())
                .then(metricRepository.deleteAll())
                .then(runRepository.deleteAll())
                .then(alertRepository.deleteAll())
                .then(connectionRepository.deleteAll())
                .block();

        runService = new SyncRunService(runRepository, metricRepository, errorRepository, rawEventRepository,
                Clock.systemDefaultZone());

        ApiConnection connection = new ApiConnection("Sunset Property Group", "https://api.test", "client-1");
        connectionId = connectionRepository.save(connection).block().getId();
    }

    @Test
    void saveRunWithDetails_RoundTripsMetricsAndErrors() {
        // Arrange
        SyncRun run = runService.createRun(connectionId, SyncMode.FULL, "api").block();
        run.start(LocalDateTime.now());
        run.recordResourceMetrics(ResourceType.PROPERTIES, new ResourceMetrics(3, 1, 0, 1, 120));
        run.addResourceError(ResourceType.PROPERTIES, new ResourceError("Invalid number in field 'sqft': big",
                Map.of("item_id", "p7", "resource", "properties"), LocalDateTime.now()));
        run.complete(LocalDateTime.now());

        // Act
        runService.saveRunWithDetails(run).block();

        // Assert
        StepVerifier.create(runService.getRunWithDetails(run.getId()))
                .assertNext(loaded -> {
                    assertThat(loaded.isCompleted()).isTrue();
                    assertThat(loaded.getTriggeredBy()).isEqualTo("api");
                    assertThat(loaded.getResourceMetrics())
                            .containsEntry(ResourceType.PROPERTIES, new ResourceMetrics(3, 1, 0, 1, 120));
                    ResourceError error = loaded.getResourceErrors().get(ResourceType.PROPERTIES).get(0);
                    assertThat(error.message()).isEqualTo("Invalid number in field 'sqft': big");
                    assertThat(error.context()).containsEntry("item_id", "p7");
                })
                .verifyComplete();
    }

    @Test
    void getLatestCompletedRun_IgnoresFailedRuns() {
        // Arrange
        SyncRun completed = finishedRun(true, Duration.ofHours(2));
        finishedRun(false, Duration.ofHours(1));

        // Act & Assert
        StepVerifier.create(runService.getLatestCompletedRun(connectionId))
                .assertNext(run -> assertThat(run.getId()).isEqualTo(completed.getId()))
                .verifyComplete();
        StepVerifier.create(runService.getLatestRun(connectionId))
                .assertNext(run -> assertThat(run.isFailed()).isTrue())
                .verifyComplete();
    }

    @Test
    void getActiveRuns_IgnoresStaleRunningRows() {
        // Arrange
        SyncRun fresh = runService.createRun(connectionId, SyncMode.INCREMENTAL, "scheduler").block();
        fresh.start(LocalDateTime.now());
        runService.saveRun(fresh).block();

        SyncRun stale = runService.createRun(connectionId, SyncMode.INCREMENTAL, "scheduler").block();
        stale.start(LocalDateTime.now());
        stale.setStartedAt(LocalDateTime.now().minusHours(5));
        runService.saveRun(stale).block();

        // Act & Assert
        StepVerifier.create(runService.getActiveRuns(connectionId, Duration.ofHours(2)).collectList())
                .assertNext(runs -> assertThat(runs).extracting(SyncRun::getId).containsExactly(fresh.getId()))
                .verifyComplete();
    }

    @Test
    void purgeExpiredRuns_DeletesInBatches() {
        // Arrange
        SyncRun oldest = finishedRun(true, Duration.ofDays(45));
        finishedRun(false, Duration.ofDays(40));
        SyncRun recent = finishedRun(true, Duration.ofDays(1));
        rawEventRepository.save(new RawEvent(oldest.getId(), "properties", "p1", "{\"property_id\":\"p1\"}")).block();

        // Act & Assert
        StepVerifier.create(runService.purgeExpiredRuns(30, 1))
                .assertNext(result -> {
                    assertThat(result.processed()).isEqualTo(1);
                    assertThat(result.moreRemaining()).isTrue();
                })
                .verifyComplete();
        StepVerifier.create(runService.purgeExpiredRuns(30, 10))
                .assertNext(result -> {
                    assertThat(result.processed()).isEqualTo(1);
                    assertThat(result.moreRemaining()).isFalse();
                })
                .verifyComplete();

        StepVerifier.create(runRepository.findAll().map(SyncRun::getId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly(recent.getId()))
                .verifyComplete();
        StepVerifier.create(rawEventRepository.countBySyncRunId(oldest.getId()))
                .expectNext(0L)
                .verifyComplete();
    }

    private SyncRun finishedRun(boolean completed, Duration endedAgo) {
        SyncRun run = runService.createRun(connectionId, SyncMode.INCREMENTAL, "scheduler").block();
        run.start(LocalDateTime.now());
        if (completed) {
            run.complete(LocalDateTime.now());
        } else {
            run.fail("units: Remote API error: 500", LocalDateTime.now());
        }
        run.setStartedAt(LocalDateTime.now().minus(endedAgo).minusMinutes(5));
        run.setEndedAt(LocalDateTime.now().minus(endedAgo));
        return runService.saveRun(run).block();
    }
}
