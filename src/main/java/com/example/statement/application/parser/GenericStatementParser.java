package com.example.statement.application.parser;

import com.example.statement.domain.model.BankParseResult;
import com.example.statement.domain.model.RawTransactionRecord;
import com.example.statement.domain.model.TransactionFields;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback parser for statements laid out as {@code date description amount [balance]} lines.
 * A trailing {@code DR} marks a debit, {@code CR} a credit.
 */
@Component
public class GenericStatementParser extends TextStatementParser {

    public static final String BANK_NAME = "other";

    private static final Logger log = LoggerFactory.getLogger(GenericStatementParser.class);
    private static final String DATE =
            "\\d{4}[-/.年]\\d{1,2}[-/.月]\\d{1,2}日?|\\d{1,2}[-/.]\\d{1,2}[-/.]\\d{4}";
    private static final Pattern TRANSACTION_LINE = Pattern.compile(
            "^(?<date>" + DATE + ")\\s+(?<description>.+?)\\s+(?<amount>" + AMOUNT + ")"
                    + "(?:\\s*(?<marker>CR|DR))?(?:\\s+(?<balance>" + AMOUNT + "))?$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String bankName() {
        return BANK_NAME;
    }

    @Override
    protected BankParseResult parseText(String text) {
        List<RawTransactionRecord> records = new ArrayList<>();
        for (String line : lines(text)) {
            Matcher matcher = TRANSACTION_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            RawTransactionRecord.Builder record = RawTransactionRecord.builder()
                    .put(TransactionFields.TRANSACTION_DATE, matcher.group("date"))
                    .put(TransactionFields.DESCRIPTION, matcher.group("description"))
                    .put(TransactionFields.TRANSACTION_AMOUNT, signedAmount(matcher.group("amount"), matcher.group("marker")));
            if (matcher.group("balance") != null) {
                record.put(TransactionFields.ACCOUNT_BALANCE, matcher.group("balance"));
            }
            records.add(record.build());
        }
        log.info("Generic parser extracted {} transactions", records.size());
        return BankParseResult.of(records);
    }

    private String signedAmount(String amount, String marker) {
        if (marker == null) {
            return amount;
        }
        String unsigned = amount.startsWith("-") || amount.startsWith("+") ? amount.substring(1) : amount;
        return "DR".equalsIgnoreCase(marker) ? "-" + unsigned : unsigned;
    }
}
