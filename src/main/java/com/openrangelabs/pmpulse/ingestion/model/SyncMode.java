package com.openrangelabs.pmpulse.ingestion.model;

/**
 * Types of synchronization runs
 */
public enum SyncMode {
    FULL("full"),
    INCREMENTAL("incremental");

    private final String value;

    SyncMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SyncMode fromValue(String value) {
        for (SyncMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid sync mode: " + value + ". Must be 'full' or 'incremental'");
    }
}
