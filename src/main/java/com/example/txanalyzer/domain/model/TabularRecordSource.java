package com.example.txanalyzer.domain.model;

/**
 * Anything that can hand over a transaction export as named columns and rows.
 * Implementations perform a single blocking read and signal unreadable input with
 * {@code SourceUnavailableException}.
 */
public interface TabularRecordSource {

	/**
	 * Reads the whole source into memory.
	 *
	 * @return header and rows in source order
	 */
    TabularData read();
}
