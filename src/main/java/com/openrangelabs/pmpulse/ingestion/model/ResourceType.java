package com.openrangelabs.pmpulse.ingestion.model;

import java.util.Arrays;
import java.util.List;

/**
 * Categories of remote data, declared in dependency order.
 * Properties come before units, units before leases, and vendors before work orders and expenses,
 * so foreign references resolve within a single pass.
 */
public enum ResourceType {

    PROPERTIES("properties", "properties", "property_id", false),
    UNITS("units", "units", "unit_id", false),
    VENDORS("vendors", "vendors", "vendor_id", false),
    LEASES("leases", "rent-roll", "occupancy_id", false),
    WORK_ORDERS("work_orders", "work-orders", "work_order_id", true),
    EXPENSES("expenses", "bill-details", "txn_id", true);

    private final String key;
    private final String endpoint;
    private final String externalIdField;
    private final boolean dateRanged;

    ResourceType(String key, String endpoint, String externalIdField, boolean dateRanged) {
        this.key = key;
        this.endpoint = endpoint;
        this.externalIdField = externalIdField;
        this.dateRanged = dateRanged;
    }

    public String getKey() { return key; }
    public String getEndpoint() { return endpoint; }
    public String getExternalIdField() { return externalIdField; }

    /**
     * Whether full runs bound this resource with a from_date/to_date window
     */
    public boolean isDateRanged() { return dateRanged; }

    /**
     * Sort the given types into processing order, dropping duplicates
     */
    public static List<ResourceType> inProcessingOrder(List<ResourceType> types) {
        return Arrays.stream(values())
                .filter(types::contains)
                .toList();
    }

    public static ResourceType fromKey(String key) {
        for (ResourceType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + key);
    }
}
