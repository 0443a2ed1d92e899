package com.example.txanalyzer.application.exception;

/**
 * Signals invalid input detected while running an analysis use case.
 * Controllers translate it into HTTP 400 unless a subclass maps to something more specific.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
