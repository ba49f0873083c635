package com.example.statement.application.parser;

import com.example.statement.application.exception.BankParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a bank name to the parser registered for it.
 */
@Component
public class BankParserRegistry {

    private static final Logger log = LoggerFactory.getLogger(BankParserRegistry.class);

    private final Map<String, BankStatementParser> parsersByBank;

    /**
     * @param parsers every parser bean in the context
     * @throws IllegalStateException when two parsers claim the same bank
     */
    public BankParserRegistry(List<BankStatementParser> parsers) {
        Map<String, BankStatementParser> byBank = new LinkedHashMap<>();
        for (BankStatementParser parser : parsers) {
            BankStatementParser previous = byBank.putIfAbsent(parser.bankName(), parser);
            if (previous != null) {
                throw new IllegalStateException("Bank '" + parser.bankName() + "' is handled by both "
                        + previous.getClass().getName() + " and " + parser.getClass().getName());
            }
        }
        this.parsersByBank = Collections.unmodifiableMap(byBank);
        log.info("Registered bank statement parsers: {}", parsersByBank.keySet());
    }

    public List<String> supportedBanks() {
        return List.copyOf(parsersByBank.keySet());
    }

    public Optional<BankStatementParser> find(String bankName) {
        return Optional.ofNullable(bankName).map(parsersByBank::get);
    }

    /**
     * @param bankName detected or requested bank
     * @return parser for that bank
     * @throws BankParserConfigurationException when no parser is registered for the bank
     */
    public BankStatementParser resolve(String bankName) {
        return find(bankName).orElseThrow(() -> new BankParserConfigurationException(
                "No bank statement parser registered for '" + bankName + "'. Supported banks: " + supportedBanks()));
    }

    /**
     * Resolves the parser for a detected bank, falling back to the generic parser for banks without their own.
     *
     * @param bankName detected bank, possibly unknown
     * @return bank parser or the generic one
     * @throws BankParserConfigurationException when neither is registered
     */
    public BankStatementParser resolveOrGeneric(String bankName) {
        Optional<BankStatementParser> parser = find(bankName);
        if (parser.isPresent()) {
            return parser.get();
        }
        log.info("No dedicated parser for '{}', using the generic statement parser", bankName);
        return resolve(GenericStatementParser.BANK_NAME);
    }
}
