package com.example.statement.application.service;

import com.example.statement.domain.model.CanonicalTransactionRecord;
import com.example.statement.domain.model.FieldValue;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.TransactionFields;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for date, amount and income/expense normalization.
 */
class TransactionNormalizerTest {

    private final TransactionNormalizer normalizer = new TransactionNormalizer();

    /**
     * A positive signed amount with thousands separators becomes income.
     */
    @Test
    void positiveTransactionAmountBecomesIncome() {
        CanonicalTransactionRecord record = normalizer.standardize(
                RawTransactionRecord.of(Map.of(TransactionFields.TRANSACTION_AMOUNT, "1,250.50")));

        assertThat(record.amount(TransactionFields.TRANSACTION_AMOUNT)).hasValue(1250.5);
        assertThat(record.amount(TransactionFields.INCOME_AMOUNT)).hasValue(1250.5);
        assertThat(record.amount(TransactionFields.EXPENSE_AMOUNT)).hasValue(0.0);
    }

    @Test
    void negativeTransactionAmountBecomesExpense() {
        CanonicalTransactionRecord record = normalizer.standardize(
                RawTransactionRecord.of(Map.of(TransactionFields.TRANSACTION_AMOUNT, "-300")));

        assertThat(record.amount(TransactionFields.TRANSACTION_AMOUNT)).hasValue(-300.0);
        assertThat(record.amount(TransactionFields.INCOME_AMOUNT)).hasValue(0.0);
        assertThat(record.amount(TransactionFields.EXPENSE_AMOUNT)).hasValue(300.0);
    }

    @Test
    void zeroAmountCountsAsExpense() {
        CanonicalTransactionRecord record = normalizer.standardize(
                RawTransactionRecord.of(Map.of(TransactionFields.TRANSACTION_AMOUNT, "0.00")));

        assertThat(record.amount(TransactionFields.INCOME_AMOUNT)).hasValue(0.0);
        assertThat(record.amount(TransactionFields.EXPENSE_AMOUNT)).hasValue(0.0);
    }

    /**
     * Existing income or expense fields suppress the split.
     */
    @Test
    void existingIncomeFieldIsNotOverwritten() {
        CanonicalTransactionRecord record = normalizer.standardize(RawTransactionRecord.builder()
                .put(TransactionFields.TRANSACTION_AMOUNT, "-50")
                .put(TransactionFields.INCOME_AMOUNT, "12.5")
                .build());

        assertThat(record.amount(TransactionFields.INCOME_AMOUNT)).hasValue(12.5);
        assertThat(record.has(TransactionFields.EXPENSE_AMOUNT)).isFalse();
    }

    @Test
    void recordWithoutTransactionAmountGetsNoSplit() {
        CanonicalTransactionRecord record = normalizer.standardize(RawTransactionRecord.of(Map.of("note", "x")));

        assertThat(record.has(TransactionFields.INCOME_AMOUNT)).isFalse();
        assertThat(record.has(TransactionFields.EXPENSE_AMOUNT)).isFalse();
        assertThat(record.value("note")).isEqualTo("x");
    }

    @Test
    void chineseDateIsRewrittenToIso() {
        CanonicalTransactionRecord record = normalizer.standardize(
                RawTransactionRecord.of(Map.of(TransactionFields.TRANSACTION_DATE, "2023年05月01日")));

        assertThat(record.value(TransactionFields.TRANSACTION_DATE)).isEqualTo("2023-05-01");
    }

    @Test
    void supportedDateLayoutsParse() {
        assertThat(normalizer.normalizeDate("2023/5/1").date()).isEqualTo(LocalDate.of(2023, 5, 1));
        assertThat(normalizer.normalizeDate("2023.05.01").date()).isEqualTo(LocalDate.of(2023, 5, 1));
        assertThat(normalizer.normalizeDate("01-05-2023").date()).isEqualTo(LocalDate.of(2023, 5, 1));
        assertThat(normalizer.normalizeDate("01/05/2023").date()).isEqualTo(LocalDate.of(2023, 5, 1));
        assertThat(normalizer.normalizeDate(" 2023-05-01 ").date()).isEqualTo(LocalDate.of(2023, 5, 1));
        assertThat(normalizer.normalizeDate(LocalDate.of(2022, 12, 31)).value()).isEqualTo("2022-12-31");
    }

    /**
     * Unparseable dates are carried unchanged instead of failing the record.
     */
    @Test
    void unparseableDateIsKept() {
        CanonicalTransactionRecord record = normalizer.standardize(
                RawTransactionRecord.of(Map.of(TransactionFields.TRANSACTION_DATE, "N/A")));

        FieldValue.DateValue date = (FieldValue.DateValue) record.field(TransactionFields.TRANSACTION_DATE);
        assertThat(date.normalized()).isFalse();
        assertThat(date.value()).isEqualTo("N/A");
        assertThat(normalizer.normalizeDate("2023-02-30").normalized()).isFalse();
        assertThat(normalizer.normalizeDate(20230501).value()).isEqualTo(20230501);
    }

    @Test
    void malformedAmountsBecomeZero() {
        assertThat(normalizer.toAmount("abc")).isEqualTo(0.0);
        assertThat(normalizer.toAmount("N/A")).isEqualTo(0.0);
        assertThat(normalizer.toAmount("")).isEqualTo(0.0);
        assertThat(normalizer.toAmount(null)).isEqualTo(0.0);
        assertThat(normalizer.toAmount("1-2")).isEqualTo(0.0);
        assertThat(normalizer.toAmount(List.of(1))).isEqualTo(0.0);
        assertThat(normalizer.toAmount(Double.NaN)).isEqualTo(0.0);
        assertThat(normalizer.toAmount("HK$ 2,000.75")).isEqualTo(2000.75);
        assertThat(normalizer.toAmount(42)).isEqualTo(42.0);
    }

    @Test
    void nullMonetaryFieldBecomesZero() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TransactionFields.EXPENSE_AMOUNT, null);
        fields.put(TransactionFields.ACCOUNT_BALANCE, "9,999.99");

        CanonicalTransactionRecord record = normalizer.standardize(RawTransactionRecord.of(fields));

        assertThat(record.amount(TransactionFields.EXPENSE_AMOUNT)).hasValue(0.0);
        assertThat(record.amount(TransactionFields.ACCOUNT_BALANCE)).hasValue(9999.99);
    }

    @Test
    void standardizeKeepsOrderAndCount() {
        List<RawTransactionRecord> records = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            records.add(RawTransactionRecord.builder()
                    .put(TransactionFields.DESCRIPTION, "row " + i)
                    .put(TransactionFields.TRANSACTION_AMOUNT, String.valueOf(i))
                    .build());
        }

        List<CanonicalTransactionRecord> normalized = normalizer.standardize(records);

        assertThat(normalized).hasSize(3);
        assertThat(normalized).extracting(record -> record.value(TransactionFields.DESCRIPTION))
                .containsExactly("row 1", "row 2", "row 3");
        assertThat(normalizer.standardize((List<RawTransactionRecord>) null)).isEmpty();
    }

    /**
     * Normalizing already normalized output changes nothing.
     */
    @Test
    void standardizeIsIdempotent() {
        RawTransactionRecord raw = RawTransactionRecord.builder()
                .put(TransactionFields.TRANSACTION_DATE, "2023年05月01日")
                .put(TransactionFields.DESCRIPTION, "Coffee")
                .put(TransactionFields.TRANSACTION_AMOUNT, "-1,250.50")
                .put(TransactionFields.ACCOUNT_BALANCE, "100")
                .build();

        CanonicalTransactionRecord once = normalizer.standardize(raw);
        CanonicalTransactionRecord twice = normalizer.standardize(once.toRaw());

        assertThat(twice).isEqualTo(once);
        assertThat(twice.toMap()).containsExactlyEntriesOf(once.toMap());
    }
}
