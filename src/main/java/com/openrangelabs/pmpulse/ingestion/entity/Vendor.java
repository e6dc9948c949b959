package com.openrangelabs.pmpulse.ingestion.entity;

import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("vendors")
public class Vendor extends SyncedEntity {

    @Column("company_name")
    private String companyName;

    @Column("contact_name")
    private String contactName;

    private String email;
    private String phone;

    @Column("vendor_type")
    private String vendorType;

    @Column("is_active")
    private Boolean active = true;

    public Vendor() {}

    public String getCompanyName() { return companyName; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }

    public String getContactName() { return contactName; }
    public void setContactName(String contactName) { this.contactName = contactName; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }

    public String getVendorType() { return vendorType; }
    public void setVendorType(String vendorType) { this.vendorType = vendorType; }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
