package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.Lease;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.repository.LeaseRepository;
import com.openrangelabs.pmpulse.ingestion.repository.UnitRepository;
import com.openrangelabs.pmpulse.ingestion.sync.SyncSession;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Leases come from the rent roll. The property is taken from the resolved unit.
 */
@Component
public class LeaseHandler extends AbstractResourceHandler<Lease> {

    private static final FieldAliases TENANT = FieldAliases.of("tenant", "tenant_name", "primary_tenant");
    private static final FieldAliases STATUS = FieldAliases.of("status", "occupancy_status", "lease_status");
    private static final FieldAliases START = FieldAliases.of("lease_from", "lease_start", "move_in");
    private static final FieldAliases END = FieldAliases.of("lease_to", "lease_end", "move_out");
    private static final FieldAliases RENT = FieldAliases.of("rent", "monthly_rent");

    private final ReferenceResolver references;
    private final UnitRepository unitRepository;

    @Autowired
    public LeaseHandler(LeaseRepository repository, ReferenceResolver references, UnitRepository unitRepository) {
        super(repository);
        this.references = references;
        this.unitRepository = unitRepository;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.LEASES;
    }

    @Override
    protected Lease createEntity() {
        return new Lease();
    }

    @Override
    protected Mono<Lease> applyRecord(JsonNode record, Lease lease) {
        return references.requireUnit(RecordValues.text(record, "unit_id"))
                .map(unit -> {
                    lease.setUnitId(unit.getId());
                    lease.setPropertyId(unit.getPropertyId());
                    lease.setTenantName(TENANT.text(record));
                    lease.setStatus(StatusVocabulary.leaseStatus(STATUS.text(record)));
                    lease.setStartDate(RecordValues.date(record, START.resolveName(record)));
                    lease.setEndDate(RecordValues.date(record, END.resolveName(record)));
                    lease.setRent(RecordValues.decimal(record, RENT.resolveName(record)));
                    return lease;
                });
    }

    /**
     * Units with an active lease are occupied regardless of the status the unit feed reported
     */
    @Override
    public Mono<Void> afterResource(SyncSession session) {
        return unitRepository.markUnitsWithActiveLeasesOccupied()
                .doOnNext(count -> logger.info("Marked {} units occupied from active leases in run {}",
                        count, session.getRun().getId()))
                .then();
    }
}
