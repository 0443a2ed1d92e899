package com.example.txanalyzer.infrastructure.exception;

/**
 * Signals that a transaction export could not be read at all (missing file, IO error, malformed CSV).
 * Fatal for the pipeline run.
 */
public class SourceUnavailableException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or OpenCSV exception
	 */
    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
