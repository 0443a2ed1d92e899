package com.example.txanalyzer.domain.service;

import com.example.txanalyzer.domain.model.CategoryMatch;
import com.example.txanalyzer.domain.model.KeywordTable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pure keyword matching used by the categorizer.
 * A keyword only matches as a whole word or phrase: the characters on either side of the occurrence
 * must not be letters or digits, so {@code rent} matches "rent due" but not "a different plan".
 */
public final class KeywordMatcher {

    private static final String NOT_ALPHANUMERIC_BEFORE = "(?<![\\p{L}\\p{N}])";
    private static final String NOT_ALPHANUMERIC_AFTER = "(?![\\p{L}\\p{N}])";

    private KeywordMatcher() {
    }

	/**
	 * Compiles the whole-phrase pattern for a lower-cased keyword.
	 *
	 * @param keyword keyword phrase, matched literally
	 * @return pattern requiring non-alphanumeric boundaries on both ends
	 */
    public static Pattern phrasePattern(String keyword) {
        return Pattern.compile(NOT_ALPHANUMERIC_BEFORE + Pattern.quote(keyword) + NOT_ALPHANUMERIC_AFTER);
    }

	/**
	 * Resolves the category of a description.
	 *
	 * @param description transaction description, may be {@code null}
	 * @param table       keyword table scanned in declaration order
	 * @return matched category, or {@link KeywordTable#UNCATEGORIZED}
	 */
    public static String categorize(String description, KeywordTable table) {
        return match(description, table).category();
    }

	/**
	 * Scans categories in table order and their keywords in declared order; the first hit wins.
	 *
	 * @param description transaction description, may be {@code null}
	 * @param table       keyword table
	 * @return category together with the keyword that selected it
	 */
    public static CategoryMatch match(String description, KeywordTable table) {
        if (description == null || description.isBlank() || table == null) {
            return CategoryMatch.uncategorized();
        }
        String normalized = description.toLowerCase(Locale.ROOT);
        for (KeywordTable.CategoryRule rule : table.rules()) {
            for (KeywordTable.Keyword keyword : rule.keywords()) {
                if (keyword.pattern().matcher(normalized).find()) {
                    return new CategoryMatch(rule.category(), keyword.phrase());
                }
            }
        }
        return CategoryMatch.uncategorized();
    }
}
