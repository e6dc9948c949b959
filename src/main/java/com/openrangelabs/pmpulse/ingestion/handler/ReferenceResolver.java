package com.openrangelabs.pmpulse.ingestion.handler;

import com.openrangelabs.pmpulse.ingestion.entity.Property;
import com.openrangelabs.pmpulse.ingestion.entity.SyncedEntity;
import com.openrangelabs.pmpulse.ingestion.entity.Unit;
import com.openrangelabs.pmpulse.ingestion.exception.UnresolvedReferenceException;
import com.openrangelabs.pmpulse.ingestion.repository.PropertyRepository;
import com.openrangelabs.pmpulse.ingestion.repository.UnitRepository;
import com.openrangelabs.pmpulse.ingestion.repository.VendorRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Looks up local parents of a remote record by their external ids
 */
@Component
public class ReferenceResolver {

    private final PropertyRepository propertyRepository;
    private final UnitRepository unitRepository;
    private final VendorRepository vendorRepository;

    @Autowired
    public ReferenceResolver(PropertyRepository propertyRepository, UnitRepository unitRepository,
                             VendorRepository vendorRepository) {
        this.propertyRepository = propertyRepository;
        this.unitRepository = unitRepository;
        this.vendorRepository = vendorRepository;
    }

    public Mono<Property> requireProperty(String externalId) {
        return require("property", externalId, propertyRepository::findByExternalId);
    }

    public Mono<Unit> requireUnit(String externalId) {
        return require("unit", externalId, unitRepository::findByExternalId);
    }

    public Mono<Optional<UUID>> optionalPropertyId(String externalId) {
        return optionalId(externalId, propertyRepository::findByExternalId);
    }

    public Mono<Optional<UUID>> optionalUnitId(String externalId) {
        return optionalId(externalId, unitRepository::findByExternalId);
    }

    public Mono<Optional<UUID>> optionalVendorId(String externalId) {
        return optionalId(externalId, vendorRepository::findByExternalId);
    }

    private <T> Mono<T> require(String referenceType, String externalId,
                                Function<String, Mono<T>> finder) {
        if (externalId == null) {
            return Mono.error(new UnresolvedReferenceException(referenceType, "(none)"));
        }
        return finder.apply(externalId)
                .switchIfEmpty(Mono.error(new UnresolvedReferenceException(referenceType, externalId)));
    }

    private <T extends SyncedEntity> Mono<Optional<UUID>> optionalId(String externalId,
                                                                      Function<String, Mono<T>> finder) {
        if (externalId == null) {
            return Mono.just(Optional.empty());
        }
        return finder.apply(externalId)
                .map(entity -> Optional.of(entity.getId()))
                .defaultIfEmpty(Optional.empty());
    }
}
