package com.example.txanalyzer.application.service;

import com.example.txanalyzer.domain.exception.PipelineStateException;
import com.example.txanalyzer.domain.model.CategorySummary;
import com.example.txanalyzer.domain.model.KeywordTable;
import com.example.txanalyzer.domain.model.MonthlySummary;
import com.example.txanalyzer.domain.model.OverallSummary;
import com.example.txanalyzer.domain.model.TransactionRecord;
import com.example.txanalyzer.domain.model.TransactionSet;
import com.example.txanalyzer.infrastructure.source.InMemoryTabularRecordSource;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for overall, per-category, monthly and top-expense summaries.
 */
class TransactionAggregatorTest {

    private final TransactionAggregator aggregator = new TransactionAggregator();

    /**
     * Runs the sample export through every stage and checks the totals.
     */
    @Test
    void endToEndSampleProducesExpectedTotals() {
        InMemoryTabularRecordSource source = new InMemoryTabularRecordSource("memory", "Date", "Description", "Amount")
                .addRow("2024-01-05", "Salary deposit", "$2,500.00")
                .addRow("2024-01-12", "Grocery store", "-45.00")
                .addRow("bad-date", "Mystery charge", "abc")
                .addRow("2024-01-25", "Electric bill", "-95.60");
        TransactionSet cleaned = new TransactionCleaner().clean(new TransactionLoader().load(source)).transactions();
        TransactionSet categorized = new TransactionCategorizer(KeywordTable.defaults()).categorize(cleaned);

        OverallSummary summary = aggregator.summarize(categorized).orElseThrow();

        assertThat(summary.totalIncome()).isEqualByComparingTo("2500.00");
        assertThat(summary.totalExpenses()).isEqualByComparingTo("-140.60");
        assertThat(summary.netAmount()).isEqualByComparingTo("2359.40");
        assertThat(summary.count()).isEqualTo(3);
        assertThat(summary.startDate()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(summary.endDate()).isEqualTo(LocalDate.of(2024, 1, 25));

        List<CategorySummary> byCategory = aggregator.summarizeByCategory(categorized);
        BigDecimal categoryTotal = byCategory.stream().map(CategorySummary::totalAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(categoryTotal).isEqualByComparingTo("2359.40");
        assertThat(byCategory).extracting(CategorySummary::category).containsExactly("Utilities", "Groceries", "Income");
    }

    @Test
    void totalsAreRoundedOnlyAtOutput() {
        TransactionSet cleaned = TransactionSet.cleaned(List.of(), List.of(
                record("2024-01-01", "0.004", "a"),
                record("2024-01-01", "0.004", "b"),
                record("2024-01-01", "0.004", "c")));

        OverallSummary summary = aggregator.summarize(cleaned).orElseThrow();

        assertThat(summary.totalIncome()).isEqualTo(new BigDecimal("0.01"));
        assertThat(summary.totalExpenses()).isEqualTo(new BigDecimal("0.00"));
        assertThat(summary.netAmount().scale()).isEqualTo(2);
    }

    @Test
    void emptySetHasNoData() {
        TransactionSet empty = TransactionSet.categorized(List.of("Date", "Description", "Amount"), List.of());

        Optional<OverallSummary> summary = aggregator.summarize(empty);

        assertThat(summary).isEmpty();
        assertThat(aggregator.summarizeByCategory(empty)).isEmpty();
        assertThat(aggregator.monthlyTotals(empty)).isEmpty();
        assertThat(aggregator.topExpenses(empty, 3)).isEmpty();
    }

    @Test
    void categoriesSortAscendingWithTiesInFirstSeenOrder() {
        TransactionSet categorized = TransactionSet.categorized(List.of(), List.of(
                categorizedRecord("10.00", "Refunds"),
                categorizedRecord("-50.00", "Dining"),
                categorizedRecord("-20.00", "Transport"),
                categorizedRecord("-30.00", "Dining"),
                categorizedRecord("-20.00", "Books"),
                categorizedRecord("-400.00", "Housing")));

        List<CategorySummary> rows = aggregator.summarizeByCategory(categorized);

        assertThat(rows).containsExactly(
                new CategorySummary("Housing", new BigDecimal("-400.00"), 1),
                new CategorySummary("Dining", new BigDecimal("-80.00"), 2),
                new CategorySummary("Transport", new BigDecimal("-20.00"), 1),
                new CategorySummary("Books", new BigDecimal("-20.00"), 1),
                new CategorySummary("Refunds", new BigDecimal("10.00"), 1));
    }

    @Test
    void categoryTotalsAddUpToNet() {
        TransactionSet categorized = TransactionSet.categorized(List.of(), List.of(
                categorizedRecord("-10.005", "A"),
                categorizedRecord("-10.005", "B"),
                categorizedRecord("-10.005", "C"),
                categorizedRecord("99.999", "D")));

        BigDecimal net = aggregator.summarize(categorized).orElseThrow().netAmount();
        double categorySum = aggregator.summarizeByCategory(categorized).stream()
                .map(CategorySummary::totalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .doubleValue();

        assertThat(categorySum).isCloseTo(net.doubleValue(), within(0.01 * 4));
    }

    @Test
    void categorySummaryRequiresCategorizedSet() {
        TransactionSet cleaned = TransactionSet.cleaned(List.of(), List.of(record("2024-01-01", "-5", "x")));

        assertThrows(PipelineStateException.class, () -> aggregator.summarizeByCategory(cleaned));
    }

    @Test
    void overallSummaryRequiresCleanedSet() {
        TransactionSet raw = TransactionSet.raw(List.of("Date", "Description", "Amount"), List.of());

        assertThrows(PipelineStateException.class, () -> aggregator.summarize(raw));
    }

    @Test
    void monthlyTotalsAreChronological() {
        TransactionSet cleaned = TransactionSet.cleaned(List.of(), List.of(
                record("2024-03-02", "-10", "late"),
                record("2024-01-15", "100", "pay"),
                record("2024-01-20", "-40", "food"),
                record("2024-03-09", "-5.5", "coffee")));

        List<MonthlySummary> months = aggregator.monthlyTotals(cleaned);

        assertThat(months).extracting(MonthlySummary::month)
                .containsExactly(YearMonth.of(2024, 1), YearMonth.of(2024, 3));
        assertThat(months.get(0).net()).isEqualByComparingTo("60.00");
        assertThat(months.get(1).expenses()).isEqualByComparingTo("-15.50");
        assertThat(months.get(1).income()).isEqualByComparingTo("0");
        assertThat(months.get(1).count()).isEqualTo(2);
    }

    @Test
    void topExpensesAreMostNegativeFirst() {
        TransactionSet cleaned = TransactionSet.cleaned(List.of(), List.of(
                record("2024-01-01", "-20", "first twenty"),
                record("2024-01-02", "500", "income"),
                record("2024-01-03", "-75", "big"),
                record("2024-01-04", "-20", "second twenty"),
                record("2024-01-05", "-1", "tiny")));

        List<TransactionRecord> top = aggregator.topExpenses(cleaned, 3);

        assertThat(top).extracting(TransactionRecord::description)
                .containsExactly("big", "first twenty", "second twenty");
        assertThrows(IllegalArgumentException.class, () -> aggregator.topExpenses(cleaned, -1));
    }

    private TransactionRecord record(String date, String amount, String description) {
        return new TransactionRecord(LocalDate.parse(date), description, new BigDecimal(amount));
    }

    private TransactionRecord categorizedRecord(String amount, String category) {
        return new TransactionRecord(LocalDate.of(2024, 2, 1), category.toLowerCase(), new BigDecimal(amount), category, Map.of());
    }
}
