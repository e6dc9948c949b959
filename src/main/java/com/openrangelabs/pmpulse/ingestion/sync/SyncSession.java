package com.openrangelabs.pmpulse.ingestion.sync;

import com.openrangelabs.pmpulse.ingestion.client.RemoteApiClient;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Working state of one running sync: the run, its connection and client,
 * the settings it started with and one tracker per processed resource type.
 */
public class SyncSession {

    private final SyncRun run;
    private final ApiConnection connection;
    private final RemoteApiClient client;
    private final IngestionProperties settings;
    private final Clock clock;
    private final LocalDateTime modifiedSince;
    private final Map<ResourceType, ResourceSyncTracker> trackers = new EnumMap<>(ResourceType.class);

    public SyncSession(SyncRun run, ApiConnection connection, RemoteApiClient client,
                       IngestionProperties settings, Clock clock, LocalDateTime modifiedSince) {
        this.run = run;
        this.connection = connection;
        this.client = client;
        this.settings = settings;
        this.clock = clock;
        this.modifiedSince = modifiedSince;
    }

    /**
     * Open the tracker for a resource. Each resource type is processed at most once per run.
     */
    public ResourceSyncTracker openTracker(ResourceType type) {
        if (trackers.containsKey(type)) {
            throw new IllegalStateException("Resource " + type.getKey() + " was already processed in run " + run.getId());
        }
        ResourceSyncTracker tracker = new ResourceSyncTracker(run, type, clock);
        trackers.put(type, tracker);
        return tracker;
    }

    public boolean isProcessed(ResourceType type) {
        return trackers.containsKey(type);
    }

    public Collection<ResourceSyncTracker> getTrackers() {
        return Collections.unmodifiableCollection(trackers.values());
    }

    public SyncRun getRun() { return run; }
    public ApiConnection getConnection() { return connection; }
    public RemoteApiClient getClient() { return client; }
    public IngestionProperties getSettings() { return settings; }
    public Clock getClock() { return clock; }

    /**
     * Lower bound for incremental fetches, null for full runs
     */
    public LocalDateTime getModifiedSince() { return modifiedSince; }
}
