package com.example.txanalyzer.interfaces.cli;

import com.example.txanalyzer.domain.model.AnalysisReport;
import com.example.txanalyzer.domain.model.CategorySummary;
import com.example.txanalyzer.domain.model.CleaningReport;
import com.example.txanalyzer.domain.model.MonthlySummary;
import com.example.txanalyzer.domain.model.OverallSummary;
import com.example.txanalyzer.domain.model.TransactionRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReportRendererTest {

    private final ConsoleReportRenderer renderer = new ConsoleReportRenderer();

    @Test
    void rendersTotalsCategoriesAndLargestExpenses() {
        AnalysisReport report = new AnalysisReport(
                "transactions.csv",
                new CleaningReport(4, 3, 1, 1, 1),
                Optional.of(new OverallSummary(new BigDecimal("2500.00"), new BigDecimal("-140.60"), new BigDecimal("2359.40"),
                        LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 25), 3)),
                List.of(new CategorySummary("Utilities", new BigDecimal("-95.60"), 1),
                        new CategorySummary("Income", new BigDecimal("2500.00"), 1)),
                List.of(new MonthlySummary(YearMonth.of(2024, 1), new BigDecimal("2500.00"), new BigDecimal("-140.60"),
                        new BigDecimal("2359.40"), 3)),
                List.of(new TransactionRecord(LocalDate.of(2024, 1, 25), "Electric bill", new BigDecimal("-95.60"))));

        String text = renderer.render(report);

        assertThat(text).contains("Transaction analysis: transactions.csv");
        assertThat(text).contains("Rows read: 4, kept: 3, dropped: 1");
        assertThat(text).contains("Period:         2024-01-05 to 2024-01-25");
        assertThat(text).contains("Total income:   2,500.00");
        assertThat(text).contains("Total expenses: -140.60");
        assertThat(text).contains("Net amount:     2,359.40");
        assertThat(text).contains("Utilities").contains("2024-01");
        assertThat(text).contains("Electric bill");
        assertThat(text.indexOf("Utilities")).isLessThan(text.indexOf("Income  "));
    }

    @Test
    void noDataReportSaysSo() {
        AnalysisReport report = new AnalysisReport("empty.csv", new CleaningReport(2, 0, 2, 2, 1),
                Optional.empty(), List.of(), List.of(), List.of());

        String text = renderer.render(report);

        assertThat(text).contains("No valid transactions to summarize.");
        assertThat(text).doesNotContain("Net amount");
    }
}
