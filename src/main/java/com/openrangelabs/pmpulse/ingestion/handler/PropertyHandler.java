package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.Property;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.repository.PropertyRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Properties have no parents. Coordinates are geocoded elsewhere and never written here.
 */
@Component
public class PropertyHandler extends AbstractResourceHandler<Property> {

    static final String UNKNOWN_NAME = "Unknown Property";

    private static final FieldAliases NAME =
            FieldAliases.of("property_name", "property_address", "property", "property_street", "name");
    private static final FieldAliases ADDRESS = FieldAliases.of("property_street", "property_address", "address");
    private static final FieldAliases CITY = FieldAliases.of("property_city", "city");
    private static final FieldAliases STATE = FieldAliases.of("property_state", "state");
    private static final FieldAliases ZIP = FieldAliases.of("property_zip", "zip", "postal_code");
    private static final FieldAliases TYPE = FieldAliases.of("property_type", "type");
    private static final FieldAliases UNIT_COUNT = FieldAliases.of("unit_count", "units");
    private static final FieldAliases SQFT = FieldAliases.of("sqft", "square_feet");
    private static final FieldAliases PORTFOLIO = FieldAliases.of("portfolio", "portfolio_name");

    @Autowired
    public PropertyHandler(PropertyRepository repository) {
        super(repository);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.PROPERTIES;
    }

    @Override
    protected Property createEntity() {
        return new Property();
    }

    @Override
    protected Mono<Property> applyRecord(JsonNode record, Property property) {
        property.setName(NAME.textOrDefault(record, UNKNOWN_NAME));
        property.setAddress(ADDRESS.text(record));
        property.setCity(CITY.text(record));
        property.setState(STATE.text(record));
        property.setZip(ZIP.text(record));
        property.setPropertyType(TYPE.text(record));
        property.setUnitCount(RecordValues.integer(record, UNIT_COUNT.resolveName(record)));
        property.setYearBuilt(RecordValues.integer(record, "year_built"));
        property.setSqft(RecordValues.integer(record, SQFT.resolveName(record)));
        property.setPortfolio(PORTFOLIO.text(record));

        String visibility = RecordValues.text(record, "visibility");
        property.setActive(visibility == null || visibility.equalsIgnoreCase("Active"));
        return Mono.just(property);
    }
}
