package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.pmpulse.ingestion.exception.RecordMappingException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordValuesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void text_TreatsBlankAndNullAsMissing() throws Exception {
        JsonNode record = objectMapper.readTree("{\"a\":\"  \",\"b\":null,\"c\":\" Oak \",\"d\":{}}");

        assertThat(RecordValues.text(record, "a")).isNull();
        assertThat(RecordValues.text(record, "b")).isNull();
        assertThat(RecordValues.text(record, "c")).isEqualTo("Oak");
        assertThat(RecordValues.text(record, "d")).isNull();
        assertThat(RecordValues.text(record, "missing")).isNull();
    }

    @Test
    void amount_StripsCurrencyFormatting() {
        assertThat(RecordValues.amount("$1,250.50", "rent")).isEqualByComparingTo(new BigDecimal("1250.50"));
        assertThat(RecordValues.amount("-75", "amount")).isEqualByComparingTo(new BigDecimal("-75"));
        assertThat(RecordValues.amount("$", "amount")).isNull();
    }

    @Test
    void amount_RejectsMalformedNumbers() {
        assertThatThrownBy(() -> RecordValues.amount("1.2.3", "rent"))
                .isInstanceOf(RecordMappingException.class)
                .hasMessageContaining("rent");
    }

    @Test
    void date_AcceptsIsoUsAndTimestampForms() throws Exception {
        JsonNode record = objectMapper.readTree(
                "{\"iso\":\"2025-02-01\",\"us\":\"2/1/2025\",\"ts\":\"2025-02-01T08:30:00Z\",\"bad\":\"Feb 1\"}");

        LocalDate expected = LocalDate.of(2025, 2, 1);
        assertThat(RecordValues.date(record, "iso")).isEqualTo(expected);
        assertThat(RecordValues.date(record, "us")).isEqualTo(expected);
        assertThat(RecordValues.date(record, "ts")).isEqualTo(expected);
        assertThatThrownBy(() -> RecordValues.date(record, "bad"))
                .isInstanceOf(RecordMappingException.class);
    }

    @Test
    void accountNumber_KeepsLeadingDigits() {
        assertThat(RecordValues.accountNumber("6210 - Water")).isEqualTo("6210");
        assertThat(RecordValues.accountNumber("Repairs")).isEqualTo("Repairs");
        assertThat(RecordValues.accountNumber(null)).isNull();
    }

    @Test
    void fieldAliases_FirstPopulatedNameWins() throws Exception {
        JsonNode record = objectMapper.readTree("{\"unit_name\":\"\",\"unit_number\":\"101\"}");
        FieldAliases aliases = FieldAliases.of("unit_name", "unit_number", "name");

        assertThat(aliases.text(record)).isEqualTo("101");
        assertThat(aliases.resolveName(record)).isEqualTo("unit_number");
        assertThat(FieldAliases.of("name").textOrDefault(record, "Unknown")).isEqualTo("Unknown");
    }
}
