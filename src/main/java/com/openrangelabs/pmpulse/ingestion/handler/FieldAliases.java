package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Ordered list of accepted field names for one value. The first name holding a non-blank value wins.
 */
public final class FieldAliases {

    private final List<String> names;

    private FieldAliases(List<String> names) {
        this.names = names;
    }

    public static FieldAliases of(String... names) {
        if (names.length == 0) {
            throw new IllegalArgumentException("At least one field name is required");
        }
        return new FieldAliases(List.of(names));
    }

    /**
     * Text of the first populated alias, or null when none is populated
     */
    public String text(JsonNode record) {
        for (String name : names) {
            String value = RecordValues.text(record, name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Name of the first populated alias, or the primary name when none is populated
     */
    public String resolveName(JsonNode record) {
        for (String name : names) {
            if (RecordValues.text(record, name) != null) {
                return name;
            }
        }
        return names.get(0);
    }

    public String textOrDefault(JsonNode record, String fallback) {
        String value = text(record);
        return value != null ? value : fallback;
    }

    public List<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return String.join("|", names);
    }
}
