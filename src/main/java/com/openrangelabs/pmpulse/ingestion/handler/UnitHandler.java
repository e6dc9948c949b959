package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.Unit;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.repository.UnitRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Units require their property to be synced first
 */
@Component
public class UnitHandler extends AbstractResourceHandler<Unit> {

    private static final FieldAliases UNIT_NUMBER = FieldAliases.of("unit_name", "unit_number", "unit");
    private static final FieldAliases STATUS = FieldAliases.of("unit_status", "status");
    private static final FieldAliases SQFT = FieldAliases.of("sqft", "square_feet");
    private static final FieldAliases BEDROOMS = FieldAliases.of("bedrooms", "bed");
    private static final FieldAliases BATHROOMS = FieldAliases.of("bathrooms", "bath");
    private static final FieldAliases MARKET_RENT = FieldAliases.of("market_rent", "advertised_rent");

    private final ReferenceResolver references;

    @Autowired
    public UnitHandler(UnitRepository repository, ReferenceResolver references) {
        super(repository);
        this.references = references;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.UNITS;
    }

    @Override
    protected Unit createEntity() {
        return new Unit();
    }

    @Override
    protected Mono<Unit> applyRecord(JsonNode record, Unit unit) {
        return references.requireProperty(RecordValues.text(record, "property_id"))
                .map(property -> {
                    unit.setPropertyId(property.getId());
                    unit.setUnitNumber(UNIT_NUMBER.textOrDefault(record, unit.getExternalId()));
                    unit.setStatus(StatusVocabulary.unitStatus(STATUS.text(record)));
                    unit.setSqft(RecordValues.integer(record, SQFT.resolveName(record)));
                    unit.setBedrooms(RecordValues.integer(record, BEDROOMS.resolveName(record)));
                    unit.setBathrooms(RecordValues.decimal(record, BATHROOMS.resolveName(record)));
                    unit.setMarketRent(RecordValues.decimal(record, MARKET_RENT.resolveName(record)));
                    unit.setRentable(RecordValues.text(record, "rentable") == null
                            || RecordValues.flag(record, "rentable", "Yes")
                            || RecordValues.flag(record, "rentable", "true"));
                    return unit;
                });
    }
}
