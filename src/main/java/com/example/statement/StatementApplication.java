package com.example.statement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point. Wires the detection, parsing and normalization services
 * and exposes them through the HTTP endpoints under the interfaces layer.
 */
@SpringBootApplication
public class StatementApplication {

	public static void main(String[] args) {
		SpringApplication.run(StatementApplication.class, args);
	}

}
