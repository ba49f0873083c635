package com.example.statement.application.parser;

import com.example.statement.domain.model.BankParseResult;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.TransactionFields;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for HSBC integrated account statements.
 * <p>
 * The statement lists HKD current, HKD savings and foreign currency savings sections. Dates and currencies are
 * only printed on the first line of a group, so later lines inherit them. Deposit and withdrawal share a column
 * once the text is flattened, so the direction is read from the running balance.
 */
@Component
public class HsbcStatementParser extends TextStatementParser {

    public static final String BANK_NAME = "HSBC";
    static final String HKD_CURRENT = "HKD Current";
    static final String HKD_SAVINGS = "HKD Savings";
    static final String FOREIGN_SAVINGS = "Foreign Currency Savings";

    private static final Logger log = LoggerFactory.getLogger(HsbcStatementParser.class);

    private static final Map<String, List<String>> SECTION_KEYWORDS = sectionKeywords();
    private static final String DATE =
            "\\d{1,2}[/\\-.]\\d{1,2}[/\\-.]\\d{4}|\\d{4}[/\\-.]\\d{1,2}[/\\-.]\\d{1,2}";
    private static final Pattern TRANSACTION_LINE = Pattern.compile(
            "^(?:(?<currency>HKD|USD|CNY|RMB|EUR|GBP|JPY|AUD|CAD|SGD|NZD|CHF)\\s+)?"
                    + "(?:(?<date>" + DATE + ")\\s+)?"
                    + "(?<description>.*?)\\s*"
                    + "(?<first>" + AMOUNT + ")(?:\\s+(?<second>" + AMOUNT + "))?$");
    private static final Pattern DATE_ONLY_LINE = Pattern.compile("^(?<date>" + DATE + ")(?:\\s+.*)?$");
    private static final Pattern BALANCE_FORWARD = Pattern.compile(
            "(?i)b/f balance|balance b/f|brought forward|承前结余|上期结余");
    private static final Pattern BALANCE_CARRIED = Pattern.compile(
            "(?i)c/f balance|balance c/f|carried forward|过后结余");
    private static final List<String> DEPOSIT_HINTS =
            List.of("deposit", "credit", "interest", "salary", "refund", "存入", "利息", "转入");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("d/M/uuuu"),
            strict("d-M-uuuu"),
            strict("d.M.uuuu"),
            strict("uuuu/M/d"),
            strict("uuuu-M-d"),
            strict("uuuu.M.d")
    );

    @Override
    public String bankName() {
        return BANK_NAME;
    }

    @Override
    protected BankParseResult parseText(String text) {
        List<RawTransactionRecord> records = new ArrayList<>();
        Map<String, SectionTotals> totals = new LinkedHashMap<>();

        String section = HKD_CURRENT;
        String currency = "HKD";
        String currentDate = null;
        BigDecimal runningBalance = null;

        for (String line : lines(text)) {
            String sectionHeader = sectionOf(line);
            if (sectionHeader != null) {
                section = sectionHeader;
                currency = FOREIGN_SAVINGS.equals(section) ? null : "HKD";
                currentDate = null;
                runningBalance = null;
                continue;
            }

            Matcher matcher = TRANSACTION_LINE.matcher(line);
            if (!matcher.matches()) {
                Matcher dateOnly = DATE_ONLY_LINE.matcher(line);
                if (dateOnly.matches()) {
                    currentDate = toIsoDate(dateOnly.group("date"));
                }
                continue;
            }

            if (matcher.group("currency") != null) {
                if (!sameCurrency(currency, matcher.group("currency"))) {
                    runningBalance = null;
                }
                currency = matcher.group("currency");
            }
            if (matcher.group("date") != null) {
                currentDate = toIsoDate(matcher.group("date"));
            }

            String description = matcher.group("description").trim();
            String first = matcher.group("first");
            String second = matcher.group("second");

            if (BALANCE_FORWARD.matcher(description).find()) {
                runningBalance = toDecimal(second != null ? second : first);
                continue;
            }
            if (BALANCE_CARRIED.matcher(description).find() || description.isEmpty()) {
                continue;
            }

            BigDecimal amount = toDecimal(first).abs();
            BigDecimal balance = toDecimal(second);
            boolean deposit = isDeposit(description, balance, runningBalance);
            if (balance != null) {
                runningBalance = balance;
            } else if (runningBalance != null) {
                runningBalance = deposit ? runningBalance.add(amount) : runningBalance.subtract(amount);
            }

            records.add(RawTransactionRecord.builder()
                    .put(TransactionFields.ACCOUNT_TYPE, section)
                    .put(TransactionFields.TRANSACTION_DATE, currentDate)
                    .put(TransactionFields.DESCRIPTION, description)
                    .put(TransactionFields.CURRENCY, currency)
                    .put(TransactionFields.INCOME_AMOUNT, deposit ? amount.toPlainString() : null)
                    .put(TransactionFields.EXPENSE_AMOUNT, deposit ? null : amount.toPlainString())
                    .put(TransactionFields.ACCOUNT_BALANCE, second)
                    .build());
            totals.computeIfAbsent(section, SectionTotals::new).add(deposit, amount);
        }

        List<RawTransactionRecord> accountTypes = totals.values().stream()
                .map(SectionTotals::toRecord)
                .toList();
        log.info("HSBC parser extracted {} transactions across {} account sections", records.size(), accountTypes.size());
        return BankParseResult.withAccountTypes(records, accountTypes);
    }

    private static boolean sameCurrency(String current, String next) {
        return current != null && current.equals(next);
    }

    private String sectionOf(String line) {
        if (TRANSACTION_LINE.matcher(line).matches()) {
            return null;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : SECTION_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    /**
     * Balance movement decides the direction; without a known previous balance the description is used.
     */
    private boolean isDeposit(String description, BigDecimal balance, BigDecimal previousBalance) {
        if (balance != null && previousBalance != null) {
            return balance.compareTo(previousBalance) > 0;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        return DEPOSIT_HINTS.stream().anyMatch(lower::contains);
    }

    private String toIsoDate(String raw) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(raw, format).toString();
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return raw;
    }

    private static Map<String, List<String>> sectionKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put(FOREIGN_SAVINGS, List.of("foreign currency savings", "外币储蓄"));
        keywords.put(HKD_CURRENT, List.of("hkd current", "港币往来"));
        keywords.put(HKD_SAVINGS, List.of("hkd savings", "港币储蓄"));
        return keywords;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private static final class SectionTotals {
        private final String accountType;
        private int count;
        private BigDecimal income = BigDecimal.ZERO;
        private BigDecimal expense = BigDecimal.ZERO;

        private SectionTotals(String accountType) {
            this.accountType = accountType;
        }

        void add(boolean deposit, BigDecimal amount) {
            count++;
            if (deposit) {
                income = income.add(amount);
            } else {
                expense = expense.add(amount);
            }
        }

        RawTransactionRecord toRecord() {
            return RawTransactionRecord.builder()
                    .put(TransactionFields.ACCOUNT_TYPE, accountType)
                    .put("transaction count", count)
                    .put(TransactionFields.INCOME_AMOUNT, income.toPlainString())
                    .put(TransactionFields.EXPENSE_AMOUNT, expense.toPlainString())
                    .build();
        }
    }
}
