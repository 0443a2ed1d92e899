package com.example.txanalyzer.infrastructure.source;

import com.example.txanalyzer.domain.model.RawRecord;
import com.example.txanalyzer.domain.model.TabularData;
import com.example.txanalyzer.domain.model.TabularRecordSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source over rows that are already in memory, e.g. assembled by another importer.
 * Cells may be text, numbers or {@code null}.
 */
public class InMemoryTabularRecordSource implements TabularRecordSource {

    private final String sourceName;
    private final List<String> columns;
    private final List<List<Object>> rows = new ArrayList<>();

    public InMemoryTabularRecordSource(String sourceName, String... columns) {
        this.sourceName = sourceName;
        this.columns = List.of(columns);
    }

	/**
	 * Appends a row; cells are matched to columns by position and missing trailing cells become {@code null}.
	 *
	 * @param cells cell values
	 * @return this source
	 */
    public InMemoryTabularRecordSource addRow(Object... cells) {
        rows.add(new ArrayList<>(Arrays.asList(cells)));
        return this;
    }

    @Override
    public TabularData read() {
        List<RawRecord> records = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<Object> cells = rows.get(r);
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), i < cells.size() ? cells.get(i) : null);
            }
            records.add(new RawRecord(r + 1, values));
        }
        return new TabularData(sourceName, columns, records);
    }
}
