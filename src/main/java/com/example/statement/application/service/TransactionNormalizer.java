package com.example.statement.application.service;

import com.example.statement.domain.model.CanonicalTransactionRecord;
import com.example.statement.domain.model.FieldValue;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.TransactionFields;

import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns bank-specific raw records into canonical transaction records.
 * Pure and total: malformed dates stay as they were, malformed amounts become {@code 0.0}.
 */
@Service
public class TransactionNormalizer {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("uuuu/M/d"),
            strict("uuuu'年'M'月'd'日'"),
            strict("uuuu.M.d"),
            strict("d-M-uuuu"),
            strict("d/M/uuuu")
    );

    /**
     * Normalizes each record, keeping order and count.
     *
     * @param records raw records from a bank parser, may be {@code null}
     * @return canonical records, one per input record
     */
    public List<CanonicalTransactionRecord> standardize(List<RawTransactionRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<CanonicalTransactionRecord> normalized = new ArrayList<>(records.size());
        for (RawTransactionRecord record : records) {
            normalized.add(standardize(record));
        }
        return normalized;
    }

    /**
     * Normalizes a single record.
     *
     * @param record raw record, {@code null} is treated as an empty record
     * @return canonical record
     */
    public CanonicalTransactionRecord standardize(RawTransactionRecord record) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        if (record == null) {
            return new CanonicalTransactionRecord(fields);
        }
        record.fields().forEach((name, value) -> fields.put(name, normalizeField(name, value)));

        if (fields.containsKey(TransactionFields.TRANSACTION_AMOUNT)
                && !fields.containsKey(TransactionFields.INCOME_AMOUNT)
                && !fields.containsKey(TransactionFields.EXPENSE_AMOUNT)) {
            double amount = ((FieldValue.AmountValue) fields.get(TransactionFields.TRANSACTION_AMOUNT)).amount();
            if (amount > 0) {
                fields.put(TransactionFields.INCOME_AMOUNT, new FieldValue.AmountValue(amount));
                fields.put(TransactionFields.EXPENSE_AMOUNT, new FieldValue.AmountValue(0.0));
            } else {
                fields.put(TransactionFields.INCOME_AMOUNT, new FieldValue.AmountValue(0.0));
                fields.put(TransactionFields.EXPENSE_AMOUNT, new FieldValue.AmountValue(Math.abs(amount)));
            }
        }
        return new CanonicalTransactionRecord(fields);
    }

    private FieldValue normalizeField(String name, Object value) {
        if (TransactionFields.TRANSACTION_DATE.equals(name)) {
            return normalizeDate(value);
        }
        if (TransactionFields.isMonetary(name)) {
            return new FieldValue.AmountValue(toAmount(value));
        }
        return new FieldValue.PassthroughValue(value);
    }

    /**
     * Tries each known date pattern in order; the first one that parses wins.
     *
     * @param value raw date value
     * @return parsed date, or the raw value unchanged
     */
    FieldValue.DateValue normalizeDate(Object value) {
        if (value instanceof LocalDate date) {
            return FieldValue.DateValue.parsed(date);
        }
        if (!(value instanceof CharSequence text)) {
            return FieldValue.DateValue.unparsed(value);
        }
        String candidate = text.toString().trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return FieldValue.DateValue.parsed(LocalDate.parse(candidate, format));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return FieldValue.DateValue.unparsed(value);
    }

    /**
     * Coerces a raw monetary value to a number.
     * Strings keep only digits, {@code .} and {@code -} before parsing, so "1,250.50" reads as 1250.5.
     *
     * @param value raw value
     * @return parsed amount, {@code 0.0} when nothing usable remains
     */
    double toAmount(Object value) {
        if (value instanceof Number number) {
            double amount = number.doubleValue();
            return Double.isNaN(amount) ? 0.0 : amount;
        }
        if (!(value instanceof CharSequence text)) {
            return 0.0;
        }
        StringBuilder digits = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= '0' && c <= '9') || c == '.' || c == '-') {
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            return 0.0;
        }
        try {
            return Double.parseDouble(digits.toString());
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
