package com.example.statement.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of a bank parser: the transaction records, plus optional per-account-type summary records.
 * Only {@link #records()} feeds normalization.
 */
public record BankParseResult(
        List<RawTransactionRecord> records,
        List<RawTransactionRecord> accountTypeRecords
) {

    public BankParseResult {
        Objects.requireNonNull(records, "records");
        records = List.copyOf(records);
        accountTypeRecords = accountTypeRecords == null ? List.of() : List.copyOf(accountTypeRecords);
    }

    public static BankParseResult of(List<RawTransactionRecord> records) {
        return new BankParseResult(records, List.of());
    }

    public static BankParseResult withAccountTypes(List<RawTransactionRecord> records,
                                                   List<RawTransactionRecord> accountTypeRecords) {
        return new BankParseResult(records, accountTypeRecords);
    }
}
