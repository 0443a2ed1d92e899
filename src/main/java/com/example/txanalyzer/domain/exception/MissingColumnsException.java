package com.example.txanalyzer.domain.exception;

import java.util.List;

/**
 * Raised when a tabular source does not declare every column the pipeline needs.
 * The check runs once against the header, before any row is looked at.
 */
public class MissingColumnsException extends DomainException {

    private final List<String> missingColumns;

	/**
	 * Creates the exception and lists the absent columns in the message.
	 *
	 * @param missingColumns required column names that were not found in the source header
	 */
    public MissingColumnsException(List<String> missingColumns) {
        super("Missing required column(s): " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
