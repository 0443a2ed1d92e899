package com.example.txanalyzer.application.service;

import com.example.txanalyzer.domain.exception.MissingColumnsException;
import com.example.txanalyzer.domain.model.TabularData;
import com.example.txanalyzer.domain.model.TabularRecordSource;
import com.example.txanalyzer.domain.model.TransactionSet;
import com.example.txanalyzer.infrastructure.exception.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * First pipeline stage: reads a tabular source and checks that its header declares the columns the
 * later stages need. Values are not inspected here.
 */
@Service
public class TransactionLoader {

    private static final Logger log = LoggerFactory.getLogger(TransactionLoader.class);

    public static final String DATE_COLUMN = "Date";
    public static final String DESCRIPTION_COLUMN = "Description";
    public static final String AMOUNT_COLUMN = "Amount";
    public static final List<String> REQUIRED_COLUMNS = List.of(DATE_COLUMN, DESCRIPTION_COLUMN, AMOUNT_COLUMN);

	/**
	 * Loads every row of the source unchanged.
	 *
	 * @param source tabular source to read once
	 * @return {@code RAW} record set in source order
	 * @throws MissingColumnsException     when a required column is absent from the header
	 * @throws SourceUnavailableException  when the source cannot be read
	 */
    public TransactionSet load(TabularRecordSource source) {
        Objects.requireNonNull(source, "source");
        TabularData data = source.read();

        List<String> missing = missingColumns(data.columns());
        if (!missing.isEmpty()) {
            log.warn("Source {} is missing required column(s) {}; found {}.", data.sourceName(), missing, data.columns());
            throw new MissingColumnsException(missing);
        }

        log.info("Loaded {} raw row(s) from {}.", data.rows().size(), data.sourceName());
        return TransactionSet.raw(data.columns(), data.rows());
    }

	/**
	 * Compares the header with {@link #REQUIRED_COLUMNS}, ignoring case and surrounding whitespace.
	 *
	 * @param columns header of the source
	 * @return required columns that are not present, in declaration order
	 */
    List<String> missingColumns(List<String> columns) {
        List<String> missing = new ArrayList<>();
        for (String required : REQUIRED_COLUMNS) {
            boolean present = columns.stream()
                    .anyMatch(column -> column != null && column.trim().equalsIgnoreCase(required));
            if (!present) {
                missing.add(required);
            }
        }
        return missing;
    }

    static boolean isRequiredColumn(String column) {
        return column != null && REQUIRED_COLUMNS.stream().anyMatch(required -> required.equalsIgnoreCase(column.trim()));
    }
}
