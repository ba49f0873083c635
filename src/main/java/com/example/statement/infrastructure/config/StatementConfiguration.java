package com.example.statement.infrastructure.config;

import com.example.statement.domain.model.BankKeywordTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the keyword tables once at startup. Both are immutable and shared by every request.
 */
@Configuration
@EnableConfigurationProperties(StatementProperties.class)
public class StatementConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StatementConfiguration.class);

    @Bean
    public BankKeywordTable defaultBankKeywords() {
        BankKeywordTable table = BankKeywordTable.builtInDefaults();
        log.info("Built-in bank keyword table loaded: {}", table.banks());
        return table;
    }

    @Bean
    public BankKeywordTable bankKeywordOverrides(StatementProperties properties) {
        BankKeywordTable table = BankKeywordTable.of(properties.getDetection().getBankMapping());
        if (!table.isEmpty()) {
            log.info("Bank keyword overrides configured for {}", table.banks());
        }
        return table;
    }
}
