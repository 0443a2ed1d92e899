package com.example.txanalyzer.application.service;

import com.example.txanalyzer.application.exception.CsvExportValidationException;
import com.example.txanalyzer.domain.model.PipelineStage;
import com.example.txanalyzer.domain.model.TransactionRecord;
import com.example.txanalyzer.domain.model.TransactionSet;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns categorized transactions into downloadable CSV content.
 */
@Service
public class CsvExportService {

	/**
	 * Renders every categorized transaction as CSV.
	 *
	 * @param transactions categorized record set
	 * @return CSV content ready to stream to the browser
	 * @throws CsvExportValidationException when no transaction is left to export
	 */
    public String exportTransactions(TransactionSet transactions) {
        if (transactions == null || transactions.isEmpty()) {
            throw new CsvExportValidationException("No valid transactions available for export.");
        }
        transactions.requireAtLeast(PipelineStage.CATEGORIZED, "CSV export");
        return buildCsv(transactions.records());
    }

    private String buildCsv(List<TransactionRecord> records) {
        StringBuilder builder = new StringBuilder();
        builder.append("Date,Description,Amount,Category\n");
        for (TransactionRecord record : records) {
            builder.append(record.date()).append(',')
                    .append(escape(record.description())).append(',')
                    .append(record.amount().toPlainString()).append(',')
                    .append(escape(record.category()))
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes or line breaks.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")
                || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
