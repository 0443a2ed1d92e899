package com.example.txanalyzer.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Aggregate totals over a non-empty record set. Monetary values carry two decimal places.
 * {@code totalExpenses} keeps its negative sign.
 */
public record OverallSummary(
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        BigDecimal netAmount,
        LocalDate startDate,
        LocalDate endDate,
        int count
) {
}
