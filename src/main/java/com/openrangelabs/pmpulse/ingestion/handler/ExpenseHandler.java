package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.entity.Expense;
import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import com.openrangelabs.pmpulse.ingestion.repository.ExpenseRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Expenses are bill detail lines. The GL account number is the numeric prefix of the account label.
 */
@Component
public class ExpenseHandler extends AbstractResourceHandler<Expense> {

    private static final FieldAliases GL_ACCOUNT = FieldAliases.of("account_number", "gl_account_number", "account");
    private static final FieldAliases GL_NAME = FieldAliases.of("account_name", "gl_account_name", "account");
    private static final FieldAliases AMOUNT = FieldAliases.of("amount", "paid", "total");
    private static final FieldAliases BILL_DATE = FieldAliases.of("bill_date", "txn_date", "date");
    private static final FieldAliases DESCRIPTION = FieldAliases.of("description", "memo");

    private final ReferenceResolver references;

    @Autowired
    public ExpenseHandler(ExpenseRepository repository, ReferenceResolver references) {
        super(repository);
        this.references = references;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.EXPENSES;
    }

    @Override
    protected Expense createEntity() {
        return new Expense();
    }

    @Override
    protected Mono<Expense> applyRecord(JsonNode record, Expense expense) {
        return Mono.zip(
                        references.optionalPropertyId(RecordValues.text(record, "property_id")),
                        references.optionalVendorId(RecordValues.text(record, "vendor_id")))
                .map(refs -> {
                    expense.setPropertyId(refs.getT1().orElse(null));
                    expense.setVendorId(refs.getT2().orElse(null));
                    expense.setGlAccountNumber(RecordValues.accountNumber(GL_ACCOUNT.text(record)));
                    expense.setGlAccountName(GL_NAME.text(record));
                    expense.setAmount(RecordValues.decimal(record, AMOUNT.resolveName(record)));
                    expense.setBillDate(RecordValues.date(record, BILL_DATE.resolveName(record)));
                    expense.setDescription(DESCRIPTION.text(record));
                    return expense;
                });
    }
}
