package com.openrangelabs.pmpulse.ingestion.model;

/**
 * Outcome of one bounded unit of work. {@code moreRemaining} tells the caller to enqueue a follow-up.
 */
public record BatchResult(int processed, boolean moreRemaining) {

    public static BatchResult empty() {
        return new BatchResult(0, false);
    }
}
