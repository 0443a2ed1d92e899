package com.example.txanalyzer.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cleaned transaction. Date and amount are always present; a positive amount is an inflow and a
 * negative amount an outflow. {@code category} stays {@code null} until the set is categorized.
 * Columns other than date, description and amount travel along untouched in {@code extraFields}.
 */
public record TransactionRecord(
        LocalDate date,
        String description,
        BigDecimal amount,
        String category,
        Map<String, Object> extraFields
) {

    public TransactionRecord {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(amount, "amount");
        description = description == null ? "" : description;
        extraFields = extraFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    public TransactionRecord(LocalDate date, String description, BigDecimal amount) {
        this(date, description, amount, null, Map.of());
    }

    public TransactionRecord withCategory(String newCategory) {
        return new TransactionRecord(date, description, amount, newCategory, extraFields);
    }

    public boolean inflow() {
        return amount.signum() > 0;
    }

    public boolean outflow() {
        return amount.signum() < 0;
    }
}
