package com.example.txanalyzer.domain.model;

/**
 * Outcome of matching one description: the chosen category and the keyword that selected it.
 * {@code keyword} is {@code null} when the description fell through to {@link KeywordTable#UNCATEGORIZED}.
 */
public record CategoryMatch(String category, String keyword) {

    public static CategoryMatch uncategorized() {
        return new CategoryMatch(KeywordTable.UNCATEGORIZED, null);
    }

    public boolean matched() {
        return keyword != null;
    }
}
