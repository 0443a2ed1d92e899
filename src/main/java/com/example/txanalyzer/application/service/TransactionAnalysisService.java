package com.example.txanalyzer.application.service;

import com.example.txanalyzer.domain.exception.TransactionFileRequiredException;
import com.example.txanalyzer.domain.model.AnalysisReport;
import com.example.txanalyzer.domain.model.CategorySummary;
import com.example.txanalyzer.domain.model.CleaningResult;
import com.example.txanalyzer.domain.model.MonthlySummary;
import com.example.txanalyzer.domain.model.OverallSummary;
import com.example.txanalyzer.domain.model.TabularRecordSource;
import com.example.txanalyzer.domain.model.TransactionRecord;
import com.example.txanalyzer.domain.model.TransactionSet;
import com.example.txanalyzer.infrastructure.config.AnalyzerProperties;
import com.example.txanalyzer.infrastructure.exception.SourceUnavailableException;
import com.example.txanalyzer.infrastructure.source.CsvTabularRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Application-layer service that runs the whole pipeline: load, clean, categorize, aggregate.
 * Any fatal failure propagates before a report is built, so callers never see partial output.
 */
@Service
public class TransactionAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TransactionAnalysisService.class);

    private final TransactionLoader loader;
    private final TransactionCleaner cleaner;
    private final TransactionCategorizer categorizer;
    private final TransactionAggregator aggregator;
    private final AnalyzerProperties properties;

    public TransactionAnalysisService(TransactionLoader loader,
                                      TransactionCleaner cleaner,
                                      TransactionCategorizer categorizer,
                                      TransactionAggregator aggregator,
                                      AnalyzerProperties properties) {
        this.loader = loader;
        this.cleaner = cleaner;
        this.categorizer = categorizer;
        this.aggregator = aggregator;
        this.properties = properties;
    }

	/**
	 * Analyzes an uploaded CSV export.
	 *
	 * @param file uploaded CSV
	 * @return full report
	 * @throws TransactionFileRequiredException when no file or an empty file was sent
	 * @throws SourceUnavailableException       when the upload cannot be read
	 */
    public AnalysisReport analyze(MultipartFile file) {
        return analyze(toSource(file), resolveFileName(file));
    }

	/**
	 * Analyzes a CSV export on disk.
	 *
	 * @param csvPath path of the export
	 * @return full report
	 */
    public AnalysisReport analyze(Path csvPath) {
        CsvTabularRecordSource source = CsvTabularRecordSource.fromPath(csvPath);
        return analyze(source, source.getSourceName());
    }

	/**
	 * Runs every stage over an arbitrary source.
	 *
	 * @param source     tabular source
	 * @param sourceName name shown in the report
	 * @return full report; {@link AnalysisReport#overall()} is empty when no row survived cleaning
	 */
    public AnalysisReport analyze(TabularRecordSource source, String sourceName) {
        TransactionSet raw = loader.load(source);
        CleaningResult cleaning = cleaner.clean(raw);
        TransactionSet categorized = categorizer.categorize(cleaning.transactions());

        Optional<OverallSummary> overall = aggregator.summarize(categorized);
        List<CategorySummary> categories = aggregator.summarizeByCategory(categorized);
        List<MonthlySummary> monthly = aggregator.monthlyTotals(categorized);
        List<TransactionRecord> topExpenses = aggregator.topExpenses(categorized, properties.getTopExpensesLimit());

        if (overall.isEmpty()) {
            log.warn("No transactions left to summarize in {}.", sourceName);
        } else {
            log.info("Analyzed {}: {} transaction(s) across {} categories.", sourceName, overall.get().count(), categories.size());
        }
        return new AnalysisReport(sourceName, cleaning.report(), overall, categories, monthly, topExpenses);
    }

	/**
	 * Loads, cleans and categorizes an upload without aggregating it.
	 *
	 * @param file uploaded CSV
	 * @return categorized record set
	 */
    public TransactionSet categorize(MultipartFile file) {
        TransactionSet raw = loader.load(toSource(file));
        return categorizer.categorize(cleaner.clean(raw).transactions());
    }

    private CsvTabularRecordSource toSource(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new TransactionFileRequiredException();
        }
        try {
            return CsvTabularRecordSource.fromBytes(resolveFileName(file), file.getBytes());
        } catch (IOException e) {
            throw new SourceUnavailableException("Unable to read the uploaded file.", e);
        }
    }

    private String resolveFileName(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "upload.csv" : name;
    }
}
