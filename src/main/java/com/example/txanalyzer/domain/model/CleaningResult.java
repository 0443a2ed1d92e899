package com.example.txanalyzer.domain.model;

/**
 * Cleaned record set plus the diagnostic describing what was dropped.
 */
public record CleaningResult(TransactionSet transactions, CleaningReport report) {
}
