package com.example.statement.domain.model;

import java.util.List;

/**
 * Field names with a fixed meaning in canonical transaction records.
 * Any other field name is bank specific and passes through normalization untouched.
 */
public final class TransactionFields {

    public static final String TRANSACTION_DATE = "transaction date";
    public static final String TRANSACTION_AMOUNT = "transaction amount";
    public static final String INCOME_AMOUNT = "income amount";
    public static final String EXPENSE_AMOUNT = "expense amount";
    public static final String ACCOUNT_BALANCE = "account balance";

    public static final List<String> MONETARY_FIELDS =
            List.of(TRANSACTION_AMOUNT, INCOME_AMOUNT, EXPENSE_AMOUNT, ACCOUNT_BALANCE);

    // Written by bank parsers and the processing pipeline, not interpreted by the normalizer.
    public static final String DESCRIPTION = "description";
    public static final String CURRENCY = "currency";
    public static final String ACCOUNT_TYPE = "account type";
    public static final String BANK = "bank";
    public static final String FILE_NAME = "file name";

    private TransactionFields() {
    }

    public static boolean isMonetary(String fieldName) {
        return MONETARY_FIELDS.contains(fieldName);
    }
}
