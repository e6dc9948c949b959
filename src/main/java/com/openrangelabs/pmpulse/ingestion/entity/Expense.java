package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One bill detail line posted against a GL account
 */
@Table("expenses")
public class Expense extends SyncedEntity {

    @Column("property_id")
    private UUID propertyId;

    @Column("vendor_id")
    private UUID vendorId;

    @Column("gl_account_number")
    private String glAccountNumber;

    @Column("gl_account_name")
    private String glAccountName;

    private BigDecimal amount;

    @Column("bill_date")
    private LocalDate billDate;

    private String description;

    public Expense() {}

    public UUID getPropertyId() { return propertyId; }
    public void setPropertyId(UUID propertyId) { this.propertyId = propertyId; }

    public UUID getVendorId() { return vendorId; }
    public void setVendorId(UUID vendorId) { this.vendorId = vendorId; }

    public String getGlAccountNumber() { return glAccountNumber; }
    public void setGlAccountNumber(String glAccountNumber) { this.glAccountNumber = glAccountNumber; }

    public String getGlAccountName() { return glAccountName; }
    public void setGlAccountName(String glAccountName) { this.glAccountName = glAccountName; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public LocalDate getBillDate() { return billDate; }
    public void setBillDate(LocalDate billDate) { this.billDate = billDate; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
