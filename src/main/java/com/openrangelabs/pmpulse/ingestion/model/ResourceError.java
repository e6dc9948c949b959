package com.openrangelabs.pmpulse.ingestion.model;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A record-level or resource-level error captured during a run
 */
public record ResourceError(String message, Map<String, String> context, LocalDateTime occurredAt) {

    public ResourceError {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public String describeContext() {
        if (context.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        context.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    if (sb.length() > 0) sb.append(", ");
                    sb.append(entry.getKey()).append('=').append(entry.getValue());
                });
        return sb.toString();
    }
}
