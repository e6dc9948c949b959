package com.openrangelabs.pmpulse.ingestion.model;

/**
 * Finalized counters for one resource type within one run
 */
public record ResourceMetrics(int created, int updated, int skipped, int errors, long durationMs) {

    public int processed() {
        return created + updated;
    }

    public int total() {
        return created + updated + skipped + errors;
    }
}
