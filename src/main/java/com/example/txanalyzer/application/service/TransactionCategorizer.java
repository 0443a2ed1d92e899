package com.example.txanalyzer.application.service;

import com.example.txanalyzer.domain.exception.PipelineStateException;
import com.example.txanalyzer.domain.model.CategoryMatch;
import com.example.txanalyzer.domain.model.KeywordTable;
import com.example.txanalyzer.domain.model.PipelineStage;
import com.example.txanalyzer.domain.model.TransactionRecord;
import com.example.txanalyzer.domain.model.TransactionSet;
import com.example.txanalyzer.domain.service.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Third pipeline stage: gives every cleaned record exactly one category using a {@link KeywordTable}.
 */
@Service
public class TransactionCategorizer {

    private static final Logger log = LoggerFactory.getLogger(TransactionCategorizer.class);

    private final KeywordTable keywordTable;

	/**
	 * @param keywordTable configured table used by {@link #categorize(TransactionSet)}
	 */
    public TransactionCategorizer(KeywordTable keywordTable) {
        this.keywordTable = keywordTable;
    }

    public TransactionSet categorize(TransactionSet transactions) {
        return categorize(transactions, keywordTable);
    }

	/**
	 * Assigns categories with an explicit table. Already categorized sets are categorized again from scratch.
	 *
	 * @param transactions cleaned record set
	 * @param table        keyword table to match against
	 * @return {@code CATEGORIZED} set, same records and order
	 * @throws PipelineStateException when the set was never cleaned
	 */
    public TransactionSet categorize(TransactionSet transactions, KeywordTable table) {
        transactions.requireAtLeast(PipelineStage.CLEANED, "Categorization");
        Objects.requireNonNull(table, "table");

        List<TransactionRecord> categorized = new ArrayList<>(transactions.size());
        int uncategorized = 0;
        for (TransactionRecord record : transactions.records()) {
            String category = KeywordMatcher.categorize(record.description(), table);
            if (KeywordTable.UNCATEGORIZED.equals(category)) {
                uncategorized++;
            }
            categorized.add(record.withCategory(category));
        }

        log.info("Categorized {} record(s), {} left as {}.", categorized.size(), uncategorized, KeywordTable.UNCATEGORIZED);
        return TransactionSet.categorized(transactions.columns(), categorized);
    }

	/**
	 * Reports which category and keyword a description resolves to with the configured table.
	 *
	 * @param description free-text description
	 * @return match details
	 */
    public CategoryMatch explain(String description) {
        return KeywordMatcher.match(description, keywordTable);
    }

    public KeywordTable getKeywordTable() {
        return keywordTable;
    }
}
