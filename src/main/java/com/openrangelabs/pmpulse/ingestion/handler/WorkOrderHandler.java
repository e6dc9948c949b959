package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.WorkOrder;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.repository.WorkOrderRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Work orders require a property. Unit and vendor links are optional and left empty when unknown.
 */
@Component
public class WorkOrderHandler extends AbstractResourceHandler<WorkOrder> {

    private static final FieldAliases STATUS = FieldAliases.of("status", "work_order_status");
    private static final FieldAliases PRIORITY = FieldAliases.of("priority", "urgency");
    private static final FieldAliases CATEGORY = FieldAliases.of("category", "work_order_type", "issue");
    private static final FieldAliases DESCRIPTION = FieldAliases.of("job_description", "description", "summary");
    private static final FieldAliases OPENED = FieldAliases.of("created_at", "created_on", "opened_on");
    private static final FieldAliases COMPLETED = FieldAliases.of("completed_on", "work_completed_on", "completed_at");
    private static final FieldAliases AMOUNT = FieldAliases.of("amount", "estimate_amount", "total");

    private final ReferenceResolver references;

    @Autowired
    public WorkOrderHandler(WorkOrderRepository repository, ReferenceResolver references) {
        super(repository);
        this.references = references;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.WORK_ORDERS;
    }

    @Override
    protected WorkOrder createEntity() {
        return new WorkOrder();
    }

    @Override
    protected Mono<WorkOrder> applyRecord(JsonNode record, WorkOrder workOrder) {
        return Mono.zip(
                        references.requireProperty(RecordValues.text(record, "property_id")),
                        references.optionalUnitId(RecordValues.text(record, "unit_id")),
                        references.optionalVendorId(RecordValues.text(record, "vendor_id")))
                .map(refs -> {
                    workOrder.setPropertyId(refs.getT1().getId());
                    workOrder.setUnitId(refs.getT2().orElse(null));
                    workOrder.setVendorId(refs.getT3().orElse(null));
                    workOrder.setStatus(StatusVocabulary.workOrderStatus(STATUS.text(record)));
                    workOrder.setPriority(StatusVocabulary.priority(PRIORITY.text(record)));
                    workOrder.setCategory(CATEGORY.text(record));
                    workOrder.setDescription(DESCRIPTION.text(record));
                    workOrder.setOpenedOn(RecordValues.date(record, OPENED.resolveName(record)));
                    workOrder.setCompletedOn(RecordValues.date(record, COMPLETED.resolveName(record)));
                    workOrder.setAmount(RecordValues.decimal(record, AMOUNT.resolveName(record)));
                    return workOrder;
                });
    }
}
