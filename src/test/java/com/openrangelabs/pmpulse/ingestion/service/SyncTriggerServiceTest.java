package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.exception.ConnectionNotConfiguredException;
import com.openrangelabs.pmpulse.ingestion.exception.ConnectionNotFoundException;
import com.openrangelabs.pmpulse.ingestion.exception.SyncAlreadyRunningException;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import com.openrangelabs.pmpulse.ingestion.sync.SyncSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncTriggerServiceTest {

    @Mock
    private ConnectionService connectionService;

    @Mock
    private SyncRunService runService;

    @Mock
    private SyncLockService lockService;

    @Mock
    private IngestionOrchestrator orchestrator;

    private SyncTriggerService triggerService;
    private ApiConnection connection;
    private SyncRun run;
    private SyncSession session;

    @BeforeEach
    void setUp() {
        triggerService = new SyncTriggerService(connectionService, runService, lockService, orchestrator,
                IngestionProperties.defaults());

        connection = new ApiConnection("Sunset Property Group", "https://api.test", "client-1");
        connection.setId(UUID.randomUUID());
        connection.setClientSecretEncrypted("encrypted");

        run = new SyncRun(connection.getId(), SyncMode.INCREMENTAL, "api");
        run.setId(UUID.randomUUID());
        session = new SyncSession(run, connection, null, IngestionProperties.defaults(), Clock.systemUTC(), null);
    }

    @Test
    void triggerSync_Success() {
        // Arrange
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.empty());
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(false))).thenReturn(Mono.just(true));
        when(lockService.release(eq(connection.getId()), anyString())).thenReturn(Mono.just(true));
        when(runService.createRun(connection.getId(), SyncMode.INCREMENTAL, "api")).thenReturn(Mono.just(run));
        when(orchestrator.startSync(run, connection)).thenReturn(Mono.just(session));
        when(orchestrator.processAll(session)).thenReturn(Mono.just(Map.of()));
        when(orchestrator.completeSync(session)).thenReturn(Mono.just(run));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(connection.getId(), SyncMode.INCREMENTAL, false, "api"))
                .expectNext(run)
                .verifyComplete();

        verify(lockService).release(eq(connection.getId()), anyString());
        verify(orchestrator, never()).failSync(any(), any());
    }

    @Test
    void triggerSync_UnexpectedErrorFailsRunAndReleasesLock() {
        // Arrange
        IllegalStateException failure = new IllegalStateException("database unavailable");
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.empty());
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(false))).thenReturn(Mono.just(true));
        when(lockService.release(eq(connection.getId()), anyString())).thenReturn(Mono.just(true));
        when(runService.createRun(connection.getId(), SyncMode.FULL, "api")).thenReturn(Mono.just(run));
        when(orchestrator.startSync(run, connection)).thenReturn(Mono.just(session));
        when(orchestrator.processAll(session)).thenReturn(Mono.error(failure));
        when(orchestrator.failSync(session, failure)).thenReturn(Mono.just(run));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(connection.getId(), SyncMode.FULL, false, "api"))
                .expectNext(run)
                .verifyComplete();

        verify(orchestrator, never()).completeSync(any());
        verify(lockService).release(eq(connection.getId()), anyString());
    }

    @Test
    void triggerSync_CallerCancellationDoesNotAbandonRun() {
        // Arrange
        Sinks.One<Map<ResourceType, ResourceMetrics>> processing = Sinks.one();
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.empty());
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(false))).thenReturn(Mono.just(true));
        when(lockService.release(eq(connection.getId()), anyString())).thenReturn(Mono.just(true));
        when(runService.createRun(connection.getId(), SyncMode.INCREMENTAL, "api")).thenReturn(Mono.just(run));
        when(orchestrator.startSync(run, connection)).thenAnswer(invocation -> {
            run.start(LocalDateTime.now());
            return Mono.just(session);
        });
        when(orchestrator.processAll(session)).thenReturn(processing.asMono());
        when(orchestrator.completeSync(session)).thenAnswer(invocation -> {
            run.complete(LocalDateTime.now());
            return Mono.just(run);
        });

        // Act
        Disposable caller = triggerService.triggerSync(connection.getId(), SyncMode.INCREMENTAL, false, "api")
                .subscribe();
        caller.dispose();
        processing.tryEmitValue(Map.of());

        // Assert
        assertThat(run.isCompleted()).isTrue();
        verify(orchestrator).completeSync(session);
        verify(orchestrator, never()).failSync(any(), any());
        verify(lockService).release(eq(connection.getId()), anyString());
    }

    @Test
    void submitSync_ReturnsRunBeforeItFinishes() {
        // Arrange
        Sinks.One<Map<ResourceType, ResourceMetrics>> processing = Sinks.one();
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.empty());
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(false))).thenReturn(Mono.just(true));
        when(lockService.release(eq(connection.getId()), anyString())).thenReturn(Mono.just(true));
        when(runService.createRun(connection.getId(), SyncMode.FULL, "api")).thenReturn(Mono.just(run));
        when(orchestrator.startSync(run, connection)).thenReturn(Mono.just(session));
        when(orchestrator.processAll(session)).thenReturn(processing.asMono());
        when(orchestrator.completeSync(session)).thenReturn(Mono.just(run));

        // Act & Assert
        StepVerifier.create(triggerService.submitSync(connection.getId(), SyncMode.FULL, false, "api"))
                .expectNext(run)
                .verifyComplete();

        verify(orchestrator, never()).completeSync(any());
        verify(lockService, never()).release(any(), anyString());

        processing.tryEmitValue(Map.of());

        verify(orchestrator).completeSync(session);
        verify(lockService).release(eq(connection.getId()), anyString());
    }

    @Test
    void submitSync_RunCreationFailureReleasesLock() {
        // Arrange
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.empty());
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(false))).thenReturn(Mono.just(true));
        when(lockService.release(eq(connection.getId()), anyString())).thenReturn(Mono.just(true));
        when(runService.createRun(connection.getId(), SyncMode.FULL, "api"))
                .thenReturn(Mono.error(new IllegalStateException("database unavailable")));

        // Act & Assert
        StepVerifier.create(triggerService.submitSync(connection.getId(), SyncMode.FULL, false, "api"))
                .expectErrorMessage("database unavailable")
                .verify();

        verify(lockService).release(eq(connection.getId()), anyString());
        verify(orchestrator, never()).startSync(any(), any());
    }

    @Test
    void triggerSync_ActiveRunRejected() {
        // Arrange
        SyncRun active = new SyncRun(connection.getId(), SyncMode.FULL, "scheduler");
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.just(active));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(connection.getId(), SyncMode.INCREMENTAL, false, "api"))
                .expectError(SyncAlreadyRunningException.class)
                .verify();

        verify(lockService, never()).acquire(any(), anyString(), anyBoolean());
        verify(runService, never()).createRun(any(), any(), anyString());
    }

    @Test
    void triggerSync_LockHeldElsewhere() {
        // Arrange
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(runService.getActiveRuns(eq(connection.getId()), any(Duration.class))).thenReturn(Flux.empty());
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(false))).thenReturn(Mono.just(false));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(connection.getId(), SyncMode.INCREMENTAL, false, "api"))
                .expectError(SyncAlreadyRunningException.class)
                .verify();

        verify(lockService, never()).release(any(), anyString());
        verify(runService, never()).createRun(any(), any(), anyString());
    }

    @Test
    void triggerSync_ForceSkipsActiveRunCheckAndTakesOverLock() {
        // Arrange
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));
        when(lockService.acquire(eq(connection.getId()), anyString(), eq(true))).thenReturn(Mono.just(true));
        when(lockService.release(eq(connection.getId()), anyString())).thenReturn(Mono.just(true));
        when(runService.createRun(connection.getId(), SyncMode.FULL, "admin")).thenReturn(Mono.just(run));
        when(orchestrator.startSync(run, connection)).thenReturn(Mono.just(session));
        when(orchestrator.processAll(session)).thenReturn(Mono.just(Map.of()));
        when(orchestrator.completeSync(session)).thenReturn(Mono.just(run));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(connection.getId(), SyncMode.FULL, true, "admin"))
                .expectNext(run)
                .verifyComplete();

        verify(runService, never()).getActiveRuns(any(), any());
    }

    @Test
    void triggerSync_UnconfiguredConnection() {
        // Arrange
        connection.setClientSecretEncrypted(null);
        when(connectionService.getConnection(connection.getId())).thenReturn(Mono.just(connection));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(connection.getId(), SyncMode.INCREMENTAL, false, "api"))
                .expectError(ConnectionNotConfiguredException.class)
                .verify();
    }

    @Test
    void triggerSync_UnknownConnection() {
        // Arrange
        UUID unknown = UUID.randomUUID();
        when(connectionService.getConnection(unknown)).thenReturn(Mono.error(new ConnectionNotFoundException(unknown)));

        // Act & Assert
        StepVerifier.create(triggerService.triggerSync(unknown, SyncMode.INCREMENTAL, false, "api"))
                .expectError(ConnectionNotFoundException.class)
                .verify();
    }
}
