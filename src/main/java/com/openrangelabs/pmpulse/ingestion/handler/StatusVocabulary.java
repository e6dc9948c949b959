package com.openrangelabs.pmpulse.ingestion.handler;

import java.util.Locale;
import java.util.Map;

/**
 * Translation of remote status and priority labels into the local vocabulary
 */
public final class StatusVocabulary {

    private static final Map<String, String> UNIT_STATUS = Map.of(
            "occupied", "occupied", "rented", "occupied", "leased", "occupied",
            "vacant", "vacant", "available", "vacant", "empty", "vacant",
            "not ready", "not_ready", "not_ready", "not_ready", "maintenance", "not_ready");

    private static final Map<String, String> LEASE_STATUS = Map.of(
            "current", "active", "notice", "active",
            "past", "past", "evict", "past",
            "future", "future");

    private static final Map<String, String> WORK_ORDER_STATUS = Map.ofEntries(
            Map.entry("open", "open"), Map.entry("new", "open"),
            Map.entry("pending", "open"), Map.entry("submitted", "open"),
            Map.entry("in_progress", "in_progress"), Map.entry("in progress", "in_progress"),
            Map.entry("assigned", "in_progress"), Map.entry("working", "in_progress"),
            Map.entry("scheduled", "in_progress"),
            Map.entry("completed", "completed"), Map.entry("done", "completed"),
            Map.entry("closed", "completed"), Map.entry("resolved", "completed"),
            Map.entry("cancelled", "cancelled"), Map.entry("canceled", "cancelled"),
            Map.entry("rejected", "cancelled"));

    private static final Map<String, String> PRIORITY = Map.ofEntries(
            Map.entry("low", "low"), Map.entry("minor", "low"),
            Map.entry("normal", "normal"), Map.entry("medium", "normal"), Map.entry("standard", "normal"),
            Map.entry("high", "high"), Map.entry("urgent", "high"), Map.entry("important", "high"),
            Map.entry("emergency", "emergency"), Map.entry("critical", "emergency"),
            Map.entry("immediate", "emergency"));

    private StatusVocabulary() {}

    /**
     * occupied | vacant | not_ready, vacant when unknown
     */
    public static String unitStatus(String remote) {
        return lookup(UNIT_STATUS, remote, "vacant");
    }

    /**
     * active | past | future, active when unknown
     */
    public static String leaseStatus(String remote) {
        return lookup(LEASE_STATUS, remote, "active");
    }

    public static String workOrderStatus(String remote) {
        return lookup(WORK_ORDER_STATUS, remote, "open");
    }

    public static String priority(String remote) {
        return lookup(PRIORITY, remote, "normal");
    }

    private static String lookup(Map<String, String> vocabulary, String remote, String fallback) {
        if (remote == null) {
            return fallback;
        }
        return vocabulary.getOrDefault(remote.trim().toLowerCase(Locale.ROOT), fallback);
    }
}
