package com.openrangelabs.pmpulse.ingestion.scheduler;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Decides how often incremental syncs run, derived from the wall clock alone.
 * Every call computes the same answer for the same minute, so uncoordinated callers agree.
 */
public interface SchedulingPolicy {

    boolean isBusinessHours();

    /**
     * Current polling interval in minutes
     */
    int getSyncInterval();

    /**
     * Whether the current minute of the hour is a multiple of the current interval
     */
    boolean shouldSyncNow();

    /**
     * Next interval boundary strictly after the current minute
     */
    ZonedDateTime getNextSyncTime();

    String getSyncModeDescription();

    /**
     * Snapshot of the settings and the current decision, for status endpoints
     */
    Map<String, Object> getConfiguration();
}
