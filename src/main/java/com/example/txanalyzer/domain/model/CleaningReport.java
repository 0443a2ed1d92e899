package com.example.txanalyzer.domain.model;

/**
 * Non-fatal diagnostic produced by the cleaner.
 * A row missing both a date and an amount counts once in {@code dropped} and once in each invalid counter.
 */
public record CleaningReport(
        int inputRows,
        int keptRows,
        int droppedRows,
        int invalidDates,
        int invalidAmounts
) {

    public boolean hasDroppedRows() {
        return droppedRows > 0;
    }
}
