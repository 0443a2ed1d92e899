package com.example.txanalyzer.domain.model;

import java.math.BigDecimal;

/**
 * Total amount and record count of one category.
 */
public record CategorySummary(String category, BigDecimal totalAmount, int count) {
}
