package com.example.statement.application.exception;

/**
 * Wiring defect around bank parsers: no parser supplied, no parser registered for a bank,
 * or a parser that breaks its contract. Distinct from bad statement data.
 */
public class BankParserConfigurationException extends ApplicationException {

	/**
	 * @param message names the parser type or bank involved
	 */
    public BankParserConfigurationException(String message) {
        super(message);
    }
}
