package com.example.txanalyzer.application.exception;

/**
 * Thrown when categorized transactions cannot be exported, typically because no row survived cleaning.
 */
public class CsvExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public CsvExportValidationException(String message) {
        super(message);
    }
}
