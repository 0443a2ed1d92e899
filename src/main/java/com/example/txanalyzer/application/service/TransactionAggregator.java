package com.example.txanalyzer.application.service;

import com.example.txanalyzer.domain.exception.PipelineStateException;
import com.example.txanalyzer.domain.model.CategorySummary;
import com.example.txanalyzer.domain.model.MonthlySummary;
import com.example.txanalyzer.domain.model.OverallSummary;
import com.example.txanalyzer.domain.model.PipelineStage;
import com.example.txanalyzer.domain.model.TransactionRecord;
import com.example.txanalyzer.domain.model.TransactionSet;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Last pipeline stage: derives summaries from cleaned or categorized records.
 * Sums are accumulated exactly and only rounded (two decimals, half up) when a summary is built.
 */
@Service
public class TransactionAggregator {

    static final int MONEY_SCALE = 2;
    static final RoundingMode MONEY_ROUNDING = RoundingMode.HALF_UP;

	/**
	 * Computes income, expenses, net flow, date range and count.
	 *
	 * @param transactions cleaned or categorized record set
	 * @return summary, or {@link Optional#empty()} when the set holds no records
	 * @throws PipelineStateException when the set was never cleaned
	 */
    public Optional<OverallSummary> summarize(TransactionSet transactions) {
        transactions.requireAtLeast(PipelineStage.CLEANED, "Overall summary");
        List<TransactionRecord> records = transactions.records();
        if (records.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        LocalDate start = null;
        LocalDate end = null;
        for (TransactionRecord record : records) {
            if (record.inflow()) {
                income = income.add(record.amount());
            } else if (record.outflow()) {
                expenses = expenses.add(record.amount());
            }
            if (start == null || record.date().isBefore(start)) {
                start = record.date();
            }
            if (end == null || record.date().isAfter(end)) {
                end = record.date();
            }
        }

        return Optional.of(new OverallSummary(
                round(income),
                round(expenses),
                round(income.add(expenses)),
                start,
                end,
                records.size()));
    }

	/**
	 * Groups records by category, ascending by total (largest outflow first). Categories with equal
	 * totals keep the order in which they first appear.
	 *
	 * @param transactions categorized record set
	 * @return one row per category present, empty for an empty set
	 * @throws PipelineStateException when the set was not categorized
	 */
    public List<CategorySummary> summarizeByCategory(TransactionSet transactions) {
        transactions.requireAtLeast(PipelineStage.CATEGORIZED, "Category summary");

        Map<String, Accumulator> groups = new LinkedHashMap<>();
        for (TransactionRecord record : transactions.records()) {
            groups.computeIfAbsent(record.category(), key -> new Accumulator()).add(record.amount());
        }

        List<CategorySummary> rows = new ArrayList<>(groups.size());
        groups.forEach((category, totals) -> rows.add(new CategorySummary(category, round(totals.net), totals.count)));
        // List.sort is stable, so equal totals stay in first-encountered order
        rows.sort(Comparator.comparing(CategorySummary::totalAmount));
        return rows;
    }

	/**
	 * Splits the records by calendar month.
	 *
	 * @param transactions cleaned or categorized record set
	 * @return one row per month that has records, oldest first
	 */
    public List<MonthlySummary> monthlyTotals(TransactionSet transactions) {
        transactions.requireAtLeast(PipelineStage.CLEANED, "Monthly summary");

        Map<YearMonth, Accumulator> months = new TreeMap<>();
        for (TransactionRecord record : transactions.records()) {
            months.computeIfAbsent(YearMonth.from(record.date()), key -> new Accumulator()).add(record.amount());
        }
        return months.entrySet().stream()
                .map(entry -> new MonthlySummary(
                        entry.getKey(),
                        round(entry.getValue().income),
                        round(entry.getValue().expenses),
                        round(entry.getValue().net),
                        entry.getValue().count))
                .toList();
    }

	/**
	 * Picks the largest outflows.
	 *
	 * @param transactions cleaned or categorized record set
	 * @param limit        maximum number of records to return
	 * @return expense records, most negative first; equal amounts keep ingestion order
	 */
    public List<TransactionRecord> topExpenses(TransactionSet transactions, int limit) {
        transactions.requireAtLeast(PipelineStage.CLEANED, "Top expenses");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        return transactions.records().stream()
                .filter(TransactionRecord::outflow)
                .sorted(Comparator.comparing(TransactionRecord::amount))
                .limit(limit)
                .toList();
    }

    static BigDecimal round(BigDecimal value) {
        return value.setScale(MONEY_SCALE, MONEY_ROUNDING);
    }

    private static final class Accumulator {
        private BigDecimal income = BigDecimal.ZERO;
        private BigDecimal expenses = BigDecimal.ZERO;
        private BigDecimal net = BigDecimal.ZERO;
        private int count;

        void add(BigDecimal amount) {
            if (amount.signum() > 0) {
                income = income.add(amount);
            } else {
                expenses = expenses.add(amount);
            }
            net = net.add(amount);
            count++;
        }
    }
}
