package com.example.statement.domain.model;

import java.time.LocalDate;

/**
 * Value of a single field in a canonical transaction record, tagged by field category.
 * Dates and monetary amounts have fixed representations; everything else is carried as-is.
 */
public interface FieldValue {

    /**
     * @return the plain value written to JSON and CSV output
     */
    Object value();

    /**
     * Transaction date. {@code date} is set when the raw value matched a known pattern,
     * otherwise the raw value is kept unchanged.
     */
    record DateValue(Object raw, LocalDate date) implements FieldValue {

        public static DateValue parsed(LocalDate date) {
            return new DateValue(date.toString(), date);
        }

        public static DateValue unparsed(Object raw) {
            return new DateValue(raw, null);
        }

        public boolean normalized() {
            return date != null;
        }

        @Override
        public Object value() {
            return date != null ? date.toString() : raw;
        }
    }

    /**
     * Monetary field; always numeric.
     */
    record AmountValue(double amount) implements FieldValue {

        @Override
        public Object value() {
            return amount;
        }
    }

    /**
     * Bank specific field copied from the raw record.
     */
    record PassthroughValue(Object raw) implements FieldValue {

        @Override
        public Object value() {
            return raw;
        }
    }
}
