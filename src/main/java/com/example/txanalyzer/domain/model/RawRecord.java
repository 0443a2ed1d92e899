package com.example.txanalyzer.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One untyped row as produced by a tabular source.
 * Values are whatever the source yields (usually text, sometimes numbers or {@code null}); column order is kept.
 */
public record RawRecord(int rowNumber, Map<String, Object> values) {

    public RawRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

	/**
	 * Looks a value up by column name, ignoring case and surrounding whitespace in the header.
	 *
	 * @param column column name such as {@code Amount}
	 * @return raw value or {@code null} when the column is absent or empty
	 */
    public Object get(String column) {
        if (values.containsKey(column)) {
            return values.get(column);
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
