package com.example.txanalyzer.domain.exception;

/**
 * Raised when an upload flow runs without a transaction export attached.
 */
public class TransactionFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public TransactionFileRequiredException() {
        super("Please choose a CSV transaction export to upload.");
    }
}
