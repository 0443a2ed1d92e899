package com.example.txanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point.
 * Starts the HTTP API and, when {@code analyzer.input-file} is set, analyzes that file on startup.
 */
@SpringBootApplication
public class TransactionAnalyzerApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(TransactionAnalyzerApplication.class, args);
	}

}
