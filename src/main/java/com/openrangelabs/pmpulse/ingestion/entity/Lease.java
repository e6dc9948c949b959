package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Table("leases")
public class Lease extends SyncedEntity {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_PAST = "past";
    public static final String STATUS_FUTURE = "future";

    @Column("unit_id")
    private UUID unitId;

    @Column("property_id")
    private UUID propertyId;

    @Column("tenant_name")
    private String tenantName;

    private String status = STATUS_ACTIVE;

    @Column("start_date")
    private LocalDate startDate;

    @Column("end_date")
    private LocalDate endDate;

    private BigDecimal rent;

    public Lease() {}

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }

    public UUID getUnitId() { return unitId; }
    public void setUnitId(UUID unitId) { this.unitId = unitId; }

    public UUID getPropertyId() { return propertyId; }
    public void setPropertyId(UUID propertyId) { this.propertyId = propertyId; }

    public String getTenantName() { return tenantName; }
    public void setTenantName(String tenantName) { this.tenantName = tenantName; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }

    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }

    public BigDecimal getRent() { return rent; }
    public void setRent(BigDecimal rent) { this.rent = rent; }
}
