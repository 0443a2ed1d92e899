package com.example.txanalyzer.domain.model;

import java.util.List;

/**
 * Header and rows read from a tabular source in one go.
 */
public record TabularData(String sourceName, List<String> columns, List<RawRecord> rows) {

    public TabularData {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
