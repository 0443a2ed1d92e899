package com.example.txanalyzer.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything one pipeline run produces, handed to a renderer (JSON endpoint or console).
 * {@code overall} is empty when no row survived cleaning; renderers have to branch on it.
 */
public record AnalysisReport(
        String sourceName,
        CleaningReport cleaning,
        Optional<OverallSummary> overall,
        List<CategorySummary> categories,
        List<MonthlySummary> monthly,
        List<TransactionRecord> topExpenses
) {

    public AnalysisReport {
        overall = overall == null ? Optional.empty() : overall;
        categories = categories == null ? List.of() : List.copyOf(categories);
        monthly = monthly == null ? List.of() : List.copyOf(monthly);
        topExpenses = topExpenses == null ? List.of() : List.copyOf(topExpenses);
    }

    public boolean hasData() {
        return overall.isPresent();
    }
}
