package com.example.statement;

import com.example.statement.application.parser.BankParserRegistry;
import com.example.statement.domain.model.BankKeywordTable;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest(properties = "statement.detection.bank-mapping.[TestBank]=TB Statement")
class StatementApplicationTests {

	@Autowired
	private BankParserRegistry parserRegistry;

	@Autowired
	@Qualifier("bankKeywordOverrides")
	private BankKeywordTable overrides;

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
	}

	@Test
	void parsersAndOverridesAreWired() {
		assertThat(parserRegistry.supportedBanks()).contains("HSBC", "other");
		assertThat(overrides.keywordsFor("TestBank")).containsExactly("TB Statement");
	}

}
