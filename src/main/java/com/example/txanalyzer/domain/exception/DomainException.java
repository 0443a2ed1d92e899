package com.example.txanalyzer.domain.exception;

/**
 * Base type for failures raised by the transaction domain model.
 * Covers schema and pipeline sequencing violations; row-level coercion problems never surface here.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule was violated
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule was violated
	 * @param cause   original exception that triggered the failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
