package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.Vendor;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.repository.VendorRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class VendorHandler extends AbstractResourceHandler<Vendor> {

    private static final FieldAliases COMPANY = FieldAliases.of("company_name", "vendor_name", "name");
    private static final FieldAliases CONTACT = FieldAliases.of("contact_name", "name");
    private static final FieldAliases EMAIL = FieldAliases.of("email", "email_address");
    private static final FieldAliases PHONE = FieldAliases.of("phone_numbers", "phone", "phone_number");
    private static final FieldAliases TYPE = FieldAliases.of("vendor_type", "type");

    @Autowired
    public VendorHandler(VendorRepository repository) {
        super(repository);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.VENDORS;
    }

    @Override
    protected Vendor createEntity() {
        return new Vendor();
    }

    @Override
    protected Mono<Vendor> applyRecord(JsonNode record, Vendor vendor) {
        vendor.setCompanyName(COMPANY.textOrDefault(record, "Unknown Vendor"));
        vendor.setContactName(CONTACT.text(record));
        vendor.setEmail(EMAIL.text(record));
        vendor.setPhone(PHONE.text(record));
        vendor.setVendorType(TYPE.text(record));
        vendor.setActive(!RecordValues.flag(record, "inactive", "Yes")
                && !RecordValues.flag(record, "inactive", "true"));
        return Mono.just(vendor);
    }
}
