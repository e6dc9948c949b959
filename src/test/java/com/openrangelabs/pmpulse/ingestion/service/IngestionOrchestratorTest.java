package com.openrangelabs.pmpulse.ingestion.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.pmpulse.ingestion.client.RemoteApiClient;
import com.openrangelabs.pmpulse.ingestion.client.RemoteApiClientFactory;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.entity.RawEvent;
import com.openrangelabs.pmpulse.ingestion.entity.SyncFailureAlert;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.exception.RecordMappingException;
import com.openrangelabs.pmpulse.ingestion.exception.RemoteApiException;
import com.openrangelabs.pmpulse.ingestion.exception.UnresolvedReferenceException;
import com.openrangelabs.pmpulse.ingestion.handler.ResourceHandler;
import com.openrangelabs.pmpulse.ingestion.model.ResourceMetrics;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.model.SyncMode;
import com.openrangelabs.pmpulse.ingestion.model.UpsertResult;
import com.openrangelabs.pmpulse.ingestion.repository.RawEventRepository;
import com.openrangelabs.pmpulse.ingestion.sync.SyncSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    @Mock
    private SyncRunService runService;

    @Mock
    private RawEventRepository rawEventRepository;

    @Mock
    private ConnectionService connectionService;

    @Mock
    private RemoteApiClientFactory clientFactory;

    @Mock
    private RemoteApiClient client;

    @Mock
    private FailureEscalationService escalationService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-12T12:00:00Z"), ZoneOffset.UTC);

    private ApiConnection connection;
    private FakeHandler propertyHandler;
    private FakeHandler unitHandler;
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        connection = new ApiConnection("Sunset Property Group", "https://api.test", "client-1");
        connection.setId(UUID.randomUUID());

        propertyHandler = new FakeHandler(ResourceType.PROPERTIES, record -> Mono.just(UpsertResult.CREATED));
        unitHandler = new FakeHandler(ResourceType.UNITS, record -> Mono.just(UpsertResult.UPDATED));

        IngestionProperties properties = IngestionProperties.defaults()
                .withSync(new IngestionProperties.Sync(100, 1000, 7, 365,
                        List.of(ResourceType.UNITS, ResourceType.PROPERTIES), Duration.ofHours(2), Duration.ofHours(2)));
        orchestrator = new IngestionOrchestrator(List.of(propertyHandler, unitHandler), runService,
                rawEventRepository, connectionService, clientFactory, escalationService, properties, clock);

        lenient().when(clientFactory.create(any(ApiConnection.class))).thenReturn(client);
        lenient().when(runService.saveRun(any(SyncRun.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(runService.saveRunWithDetails(any(SyncRun.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(runService.getLatestCompletedRun(any(UUID.class))).thenReturn(Mono.empty());
        lenient().when(rawEventRepository.save(any(RawEvent.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(connectionService.markSuccess(any(ApiConnection.class))).thenReturn(Mono.just(connection));
        lenient().when(connectionService.markError(any(ApiConnection.class), anyString())).thenReturn(Mono.just(connection));
        lenient().when(escalationService.handleSyncCompleted(any(SyncRun.class)))
                .thenReturn(Mono.just(new SyncFailureAlert(connection.getId())));
    }

    @Test
    void runSync_BadRecordIsCountedAndRunCompletes() {
        // Arrange
        propertyHandler.behaviour = record -> "p5".equals(record.get("property_id").asText())
                ? Mono.error(new RecordMappingException("Invalid number in field 'units': many"))
                : Mono.just(UpsertResult.CREATED);
        when(client.fetchAll(eq(ResourceType.PROPERTIES), anyMap())).thenReturn(Flux.fromIterable(records("property_id", "p", 10)));
        when(client.fetchAll(eq(ResourceType.UNITS), anyMap())).thenReturn(Flux.empty());

        // Act
        SyncRun run = runSync(SyncMode.INCREMENTAL);

        // Assert
        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getResourcesSynced()).isEqualTo(9);
        assertThat(run.getErrorsCount()).isEqualTo(1);
        assertThat(run.getErrorSummary()).isEqualTo("properties: Invalid number in field 'units': many");

        ResourceMetrics metrics = run.getResourceMetrics().get(ResourceType.PROPERTIES);
        assertThat(metrics.created()).isEqualTo(9);
        assertThat(metrics.errors()).isEqualTo(1);
        assertThat(run.getResourceErrors().get(ResourceType.PROPERTIES).get(0).context())
                .containsEntry("item_id", "p5")
                .containsEntry("resource", "properties");

        verify(rawEventRepository, times(10)).save(any(RawEvent.class));
        verify(connectionService).markSuccess(connection);
        verify(escalationService).handleSyncCompleted(run);
    }

    @Test
    void runSync_RunTimesFollowInjectedClock() {
        // Arrange
        when(client.fetchAll(any(ResourceType.class), anyMap())).thenReturn(Flux.empty());

        // Act
        SyncRun run = runSync(SyncMode.INCREMENTAL);

        // Assert
        assertThat(run.getStartedAt()).isEqualTo(LocalDateTime.of(2025, 3, 12, 12, 0));
        assertThat(run.getEndedAt()).isEqualTo(LocalDateTime.of(2025, 3, 12, 12, 0));
    }

    @Test
    void runSync_ResourcesRunInDependencyOrder() {
        // Arrange
        List<ResourceType> fetched = new ArrayList<>();
        when(client.fetchAll(any(ResourceType.class), anyMap())).thenAnswer(invocation -> {
            fetched.add(invocation.getArgument(0));
            return Flux.empty();
        });

        // Act
        runSync(SyncMode.FULL);

        // Assert
        assertThat(fetched).containsExactly(ResourceType.PROPERTIES, ResourceType.UNITS);
        assertThat(propertyHandler.afterResourceCalls).isEqualTo(1);
        assertThat(unitHandler.afterResourceCalls).isEqualTo(1);
    }

    @Test
    void runSync_FetchFailureAbortsResourceAndFailsRun() {
        // Arrange
        when(client.fetchAll(eq(ResourceType.PROPERTIES), anyMap()))
                .thenReturn(Flux.error(RemoteApiException.clientError(404, "missing")));
        when(client.fetchAll(eq(ResourceType.UNITS), anyMap()))
                .thenReturn(Flux.fromIterable(records("unit_id", "u", 2)));

        // Act
        SyncRun run = runSync(SyncMode.INCREMENTAL);

        // Assert
        assertThat(run.isFailed()).isTrue();
        assertThat(run.getErrorSummary())
                .isEqualTo("properties: Failed to fetch properties: Remote API error: 404 - missing");
        assertThat(run.getResourceMetrics().get(ResourceType.PROPERTIES).errors()).isEqualTo(1);
        assertThat(run.getResourceMetrics().get(ResourceType.UNITS).updated()).isEqualTo(2);
        assertThat(run.getResourceErrors().get(ResourceType.PROPERTIES).get(0).context())
                .containsEntry("status", "404");
        assertThat(propertyHandler.afterResourceCalls).isZero();

        verify(connectionService).markError(eq(connection), anyString());
        verify(connectionService, never()).markSuccess(any());
        verify(escalationService).handleSyncCompleted(run);
    }

    @Test
    void runSync_UnresolvedReferenceIsSkipped() {
        // Arrange
        unitHandler.behaviour = record -> Mono.error(new UnresolvedReferenceException("property", "p-404"));
        when(client.fetchAll(eq(ResourceType.PROPERTIES), anyMap())).thenReturn(Flux.empty());
        when(client.fetchAll(eq(ResourceType.UNITS), anyMap())).thenReturn(Flux.fromIterable(records("unit_id", "u", 1)));

        // Act
        SyncRun run = runSync(SyncMode.INCREMENTAL);

        // Assert
        ResourceMetrics metrics = run.getResourceMetrics().get(ResourceType.UNITS);
        assertThat(metrics.skipped()).isEqualTo(1);
        assertThat(metrics.errors()).isZero();
        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getErrorSummary()).isNull();
        verify(rawEventRepository).save(any(RawEvent.class));
    }

    @Test
    void runSync_RecordWithoutIdStillKeepsRawEvent() throws Exception {
        // Arrange
        JsonNode record = objectMapper.readTree("{\"name\":\"No Id Plaza\"}");
        when(client.fetchAll(eq(ResourceType.PROPERTIES), anyMap())).thenReturn(Flux.just(record));
        when(client.fetchAll(eq(ResourceType.UNITS), anyMap())).thenReturn(Flux.empty());

        // Act
        SyncRun run = runSync(SyncMode.INCREMENTAL);

        // Assert
        ArgumentCaptor<RawEvent> captor = ArgumentCaptor.forClass(RawEvent.class);
        verify(rawEventRepository).save(captor.capture());
        assertThat(captor.getValue().getExternalId()).isNull();
        assertThat(captor.getValue().getResourceType()).isEqualTo("properties");
        assertThat(captor.getValue().getPayload()).contains("No Id Plaza");

        assertThat(run.getErrorSummary()).isEqualTo("properties: Record has no property_id");
        assertThat(propertyHandler.upserted).isEmpty();
    }

    @Test
    void runSync_ErrorSummaryIsTruncated() {
        // Arrange
        propertyHandler.behaviour = record -> Mono.error(new RecordMappingException("bad " + record.get("property_id").asText()));
        when(client.fetchAll(eq(ResourceType.PROPERTIES), anyMap())).thenReturn(Flux.fromIterable(records("property_id", "p", 12)));
        when(client.fetchAll(eq(ResourceType.UNITS), anyMap())).thenReturn(Flux.empty());

        // Act
        SyncRun run = runSync(SyncMode.INCREMENTAL);

        // Assert
        String[] lines = run.getErrorSummary().split("\n");
        assertThat(lines).hasSize(IngestionOrchestrator.ERROR_SUMMARY_LIMIT + 1);
        assertThat(lines[lines.length - 1]).isEqualTo("... and 2 more errors");
        assertThat(run.getErrorsCount()).isEqualTo(12);
    }

    @Test
    void startSync_IncrementalUsesLastCompletedRun() {
        // Arrange
        SyncRun previous = new SyncRun(connection.getId(), SyncMode.INCREMENTAL, "scheduler");
        previous.setEndedAt(LocalDateTime.of(2025, 3, 11, 8, 0));
        when(runService.getLatestCompletedRun(connection.getId())).thenReturn(Mono.just(previous));

        // Act
        SyncSession session = orchestrator.startSync(newRun(SyncMode.INCREMENTAL), connection).block();

        // Assert
        assertThat(session.getRun().isRunning()).isTrue();
        assertThat(orchestrator.buildParams(session, ResourceType.WORK_ORDERS))
                .containsExactly(Map.entry("modified_since", "2025-03-11T08:00:00"));
    }

    @Test
    void startSync_IncrementalFallsBackToConfiguredWindow() {
        SyncSession session = orchestrator.startSync(newRun(SyncMode.INCREMENTAL), connection).block();

        assertThat(session.getModifiedSince()).isEqualTo(LocalDateTime.of(2025, 3, 5, 12, 0));
    }

    @Test
    void buildParams_FullSyncBoundsDateRangedResources() {
        // Act
        SyncSession session = orchestrator.startSync(newRun(SyncMode.FULL), connection).block();

        // Assert
        assertThat(session.getModifiedSince()).isNull();
        assertThat(orchestrator.buildParams(session, ResourceType.WORK_ORDERS))
                .containsEntry("from_date", "2024-03-12")
                .containsEntry("to_date", "2025-03-12");
        assertThat(orchestrator.buildParams(session, ResourceType.UNITS)).isEmpty();
        verify(runService, never()).getLatestCompletedRun(any());
    }

    @Test
    void startSync_RejectsRunThatAlreadyStarted() {
        SyncRun run = newRun(SyncMode.FULL);
        run.start(LocalDateTime.now(clock));

        StepVerifier.create(orchestrator.startSync(run, connection))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void processResource_TypeCanOnlyBeProcessedOncePerRun() {
        // Arrange
        when(client.fetchAll(eq(ResourceType.UNITS), anyMap())).thenReturn(Flux.empty());
        SyncSession session = orchestrator.startSync(newRun(SyncMode.FULL), connection).block();
        orchestrator.processResource(session, ResourceType.UNITS).block();

        // Act & Assert
        StepVerifier.create(orchestrator.processResource(session, ResourceType.UNITS))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void processResource_UnknownHandler() {
        SyncSession session = orchestrator.startSync(newRun(SyncMode.FULL), connection).block();

        StepVerifier.create(orchestrator.processResource(session, ResourceType.EXPENSES))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void failSync_FailsRunAndReportsIt() {
        // Arrange
        SyncSession session = orchestrator.startSync(newRun(SyncMode.FULL), connection).block();

        // Act
        SyncRun run = orchestrator.failSync(session, new IllegalStateException("database unavailable")).block();

        // Assert
        assertThat(run.isFailed()).isTrue();
        assertThat(run.getErrorSummary()).isEqualTo("Sync failed: database unavailable");
        verify(connectionService).markError(connection, "Sync failed: database unavailable");
        verify(escalationService).handleSyncCompleted(run);
    }

    @Test
    void constructor_RejectsDuplicateHandlers() {
        FakeHandler duplicate = new FakeHandler(ResourceType.PROPERTIES, record -> Mono.just(UpsertResult.CREATED));

        assertThatThrownBy(() -> new IngestionOrchestrator(List.of(propertyHandler, duplicate), runService,
                rawEventRepository, connectionService, clientFactory, escalationService,
                IngestionProperties.defaults(), clock))
                .isInstanceOf(IllegalStateException.class);
    }

    private SyncRun runSync(SyncMode mode) {
        return orchestrator.startSync(newRun(mode), connection)
                .flatMap(session -> orchestrator.processAll(session)
                        .then(orchestrator.completeSync(session)))
                .block();
    }

    private SyncRun newRun(SyncMode mode) {
        SyncRun run = new SyncRun(connection.getId(), mode, "test");
        run.setId(UUID.randomUUID());
        return run;
    }

    private List<JsonNode> records(String idField, String prefix, int count) {
        List<JsonNode> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(objectMapper.createObjectNode()
                    .put(idField, prefix + i)
                    .put("name", "Record " + i));
        }
        return records;
    }

    private static class FakeHandler implements ResourceHandler {

        private final ResourceType type;
        private Function<JsonNode, Mono<UpsertResult>> behaviour;
        private final List<String> upserted = new ArrayList<>();
        private int afterResourceCalls;

        FakeHandler(ResourceType type, Function<JsonNode, Mono<UpsertResult>> behaviour) {
            this.type = type;
            this.behaviour = behaviour;
        }

        @Override
        public ResourceType getResourceType() {
            return type;
        }

        @Override
        public Mono<UpsertResult> upsert(String externalId, JsonNode record) {
            return behaviour.apply(record).doOnNext(result -> upserted.add(externalId));
        }

        @Override
        public Mono<Void> afterResource(SyncSession session) {
            return Mono.fromRunnable(() -> afterResourceCalls++);
        }
    }
}
