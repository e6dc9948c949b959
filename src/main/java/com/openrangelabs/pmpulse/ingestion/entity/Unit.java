package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.util.UUID;

@Table("units")
public class Unit extends SyncedEntity {

    public static final String STATUS_OCCUPIED = "occupied";
    public static final String STATUS_VACANT = "vacant";
    public static final String STATUS_NOT_READY = "not_ready";

    @Column("property_id")
    private UUID propertyId;

    @Column("unit_number")
    private String unitNumber;

    private String status = STATUS_VACANT;

    private Integer sqft;
    private Integer bedrooms;
    private BigDecimal bathrooms;

    @Column("market_rent")
    private BigDecimal marketRent;

    @Column("is_rentable")
    private Boolean rentable = true;

    public Unit() {}

    public UUID getPropertyId() { return propertyId; }
    public void setPropertyId(UUID propertyId) { this.propertyId = propertyId; }

    public String getUnitNumber() { return unitNumber; }
    public void setUnitNumber(String unitNumber) { this.unitNumber = unitNumber; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Integer getSqft() { return sqft; }
    public void setSqft(Integer sqft) { this.sqft = sqft; }

    public Integer getBedrooms() { return bedrooms; }
    public void setBedrooms(Integer bedrooms) { this.bedrooms = bedrooms; }

    public BigDecimal getBathrooms() { return bathrooms; }
    public void setBathrooms(BigDecimal bathrooms) { this.bathrooms = bathrooms; }

    public BigDecimal getMarketRent() { return marketRent; }
    public void setMarketRent(BigDecimal marketRent) { this.marketRent = marketRent; }

    public Boolean getRentable() { return rentable; }
    public void setRentable(Boolean rentable) { this.rentable = rentable; }

    @Override
    public String toString() {
        return "Unit{id=" + getId() + ", externalId='" + getExternalId() + "', unitNumber='" + unitNumber
                + "', status='" + status + "'}";
    }
}
