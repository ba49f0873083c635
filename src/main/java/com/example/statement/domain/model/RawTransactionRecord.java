package com.example.statement.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transaction record as produced by a bank parser: field name to raw value (string, number or {@code null}).
 * Field order is preserved; values may be {@code null}, so the map is copied rather than {@code Map.copyOf}'d.
 */
public final class RawTransactionRecord {

    private final Map<String, Object> fields;

    private RawTransactionRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Copies the given fields into a new record.
     *
     * @param fields ordered field map, {@code null} values allowed
     * @return immutable record
     */
    public static RawTransactionRecord of(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            copy.putAll(fields);
        }
        return new RawTransactionRecord(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public Object get(String fieldName) {
        return fields.get(fieldName);
    }

    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Returns a copy with an additional (or replaced) field appended in order.
     *
     * @param fieldName field to set
     * @param value     raw value
     * @return new record
     */
    public RawTransactionRecord with(String fieldName, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(fieldName, value);
        return new RawTransactionRecord(copy);
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof RawTransactionRecord record && fields.equals(record.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "RawTransactionRecord" + fields;
    }

    /**
     * Fluent builder used by bank parsers.
     */
    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String fieldName, Object value) {
            fields.put(fieldName, value);
            return this;
        }

        public RawTransactionRecord build() {
            return new RawTransactionRecord(new LinkedHashMap<>(fields));
        }
    }
}
