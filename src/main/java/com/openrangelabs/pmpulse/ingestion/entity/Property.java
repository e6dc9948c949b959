package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;

/**
 * A managed property. Latitude and longitude are filled in by geocoding and never written by sync.
 */
@Table("properties")
public class Property extends SyncedEntity {

    private String name;
    private String address;
    private String city;
    private String state;
    private String zip;

    @Column("property_type")
    private String propertyType;

    @Column("unit_count")
    private Integer unitCount;

    @Column("year_built")
    private Integer yearBuilt;

    private Integer sqft;

    private String portfolio;

    @Column("is_active")
    private Boolean active = true;

    private BigDecimal latitude;
    private BigDecimal longitude;

    public Property() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public String getZip() { return zip; }
    public void setZip(String zip) { this.zip = zip; }

    public String getPropertyType() { return propertyType; }
    public void setPropertyType(String propertyType) { this.propertyType = propertyType; }

    public Integer getUnitCount() { return unitCount; }
    public void setUnitCount(Integer unitCount) { this.unitCount = unitCount; }

    public Integer getYearBuilt() { return yearBuilt; }
    public void setYearBuilt(Integer yearBuilt) { this.yearBuilt = yearBuilt; }

    public Integer getSqft() { return sqft; }
    public void setSqft(Integer sqft) { this.sqft = sqft; }

    public String getPortfolio() { return portfolio; }
    public void setPortfolio(String portfolio) { this.portfolio = portfolio; }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public BigDecimal getLatitude() { return latitude; }
    public void setLatitude(BigDecimal latitude) { this.latitude = latitude; }

    public BigDecimal getLongitude() { return longitude; }
    public void setLongitude(BigDecimal longitude) { this.longitude = longitude; }

    @Override
    public String toString() {
        return "Property{id=" + getId() + ", externalId='" + getExternalId() + "', name='" + name + "'}";
    }
}
