package com.example.statement.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Normalized transaction record. Keeps the raw record's field order, with the transaction date,
 * the monetary fields and any synthesized income/expense split rewritten to their canonical form.
 */
public final class CanonicalTransactionRecord {

    private final Map<String, FieldValue> fields;

    /**
     * @param fields ordered, already normalized field values
     */
    public CanonicalTransactionRecord(Map<String, FieldValue> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, FieldValue> fields() {
        return fields;
    }

    public boolean has(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public FieldValue field(String fieldName) {
        return fields.get(fieldName);
    }

    /**
     * @param fieldName monetary field name
     * @return the amount, or empty when the field is absent
     */
    public OptionalDouble amount(String fieldName) {
        FieldValue value = fields.get(fieldName);
        if (value instanceof FieldValue.AmountValue amountValue) {
            return OptionalDouble.of(amountValue.amount());
        }
        return OptionalDouble.empty();
    }

    /**
     * @param fieldName field name
     * @return plain value as exported, {@code null} when absent
     */
    public Object value(String fieldName) {
        FieldValue value = fields.get(fieldName);
        return value == null ? null : value.value();
    }

    /**
     * Flattens the record into field name to plain value, as serialized to JSON.
     *
     * @return ordered map
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((name, value) -> plain.put(name, value.value()));
        return plain;
    }

    /**
     * Converts back into a raw record so normalized output can be fed through normalization again.
     *
     * @return raw record with plain values
     */
    public RawTransactionRecord toRaw() {
        return RawTransactionRecord.of(toMap());
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof CanonicalTransactionRecord record && fields.equals(record.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalTransactionRecord" + toMap();
    }
}
