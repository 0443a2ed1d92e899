package com.example.txanalyzer.domain.model;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Income, expenses and net flow of one calendar month.
 */
public record MonthlySummary(
        YearMonth month,
        BigDecimal income,
        BigDecimal expenses,
        BigDecimal net,
        int count
) {
}
