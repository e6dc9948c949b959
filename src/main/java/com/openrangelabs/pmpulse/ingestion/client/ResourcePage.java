package com.openrangelabs.pmpulse.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;

import java.util.List;

/**
 * One page of remote records
 */
public record ResourcePage(ResourceType resourceType, int page, List<JsonNode> items, boolean hasMore) {

    public ResourcePage {
        items = List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
