package com.openrangelabs.pmpulse.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.pmpulse.ingestion.exception.RecordMappingException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for remote record fields. Missing or blank values read as null,
 * values that are present but malformed raise {@link RecordMappingException}.
 */
public final class RecordValues {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern US_DATE = Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{4}");
    private static final DateTimeFormatter US_DATE_FORMAT = DateTimeFormatter.ofPattern("M/d/yyyy");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    private RecordValues() {}

    public static String text(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    public static Integer integer(JsonNode record, String field) {
        String value = text(record, field);
        if (value == null) {
            return null;
        }
        BigDecimal parsed = amount(value, field);
        return parsed == null ? null : parsed.intValue();
    }

    public static BigDecimal decimal(JsonNode record, String field) {
        return amount(text(record, field), field);
    }

    /**
     * Parse a money or number string, ignoring currency symbols, separators and whitespace
     */
    public static BigDecimal amount(String raw, String field) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("[^0-9.\\-]", "");
        if (cleaned.isEmpty() || cleaned.equals("-") || cleaned.equals(".")) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new RecordMappingException("Invalid number in field '" + field + "': " + raw, e);
        }
    }

    public static LocalDate date(JsonNode record, String field) {
        String value = text(record, field);
        if (value == null) {
            return null;
        }
        String datePart = value.length() > 10 && value.charAt(10) == 'T' ? value.substring(0, 10) : value;
        DateTimeFormatter format;
        if (ISO_DATE.matcher(datePart).matches()) {
            format = DateTimeFormatter.ISO_LOCAL_DATE;
        } else if (US_DATE.matcher(datePart).matches()) {
            format = US_DATE_FORMAT;
        } else {
            throw new RecordMappingException("Invalid date in field '" + field + "': " + value);
        }
        try {
            return LocalDate.parse(datePart, format);
        } catch (DateTimeParseException e) {
            throw new RecordMappingException("Invalid date in field '" + field + "': " + value, e);
        }
    }

    public static boolean flag(JsonNode record, String field, String trueValue) {
        String value = text(record, field);
        return value != null && value.equalsIgnoreCase(trueValue);
    }

    /**
     * Leading digits of a GL account label, e.g. "6210 - Water" gives "6210".
     * Labels without a numeric prefix are returned as is.
     */
    public static String accountNumber(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = LEADING_DIGITS.matcher(raw.trim());
        return matcher.find() ? matcher.group(1) : raw.trim();
    }
}
