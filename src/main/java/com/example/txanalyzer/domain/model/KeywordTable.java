package com.example.txanalyzer.domain.model;

import com.example.txanalyzer.domain.service.KeywordMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable, insertion-ordered mapping of category name to keyword phrases.
 * Declaration order decides ties: when two categories both match a description, the one declared first wins.
 * Keywords are stored lower-cased together with their precompiled whole-phrase patterns.
 */
public final class KeywordTable {

    public static final String UNCATEGORIZED = "Uncategorized";

    private final List<CategoryRule> rules;

    private KeywordTable(List<CategoryRule> rules) {
        this.rules = List.copyOf(rules);
    }

	/**
	 * Builds a table from an ordered map. Iteration order of {@code categories} becomes the match order,
	 * so callers should pass a {@link LinkedHashMap} (or another ordered map).
	 *
	 * @param categories category name to keyword list
	 * @return immutable table
	 * @throws IllegalArgumentException when a category name or keyword is blank
	 */
    public static KeywordTable of(Map<String, List<String>> categories) {
        Builder builder = builder();
        if (categories != null) {
            categories.forEach(builder::category);
        }
        return builder.build();
    }

    public static KeywordTable empty() {
        return new KeywordTable(List.of());
    }

	/**
	 * Built-in table used when no categories are configured.
	 *
	 * @return default personal-finance categories
	 */
    public static KeywordTable defaults() {
        return builder()
                .category("Income", "salary", "payroll", "direct deposit", "paycheck", "refund", "interest")
                .category("Housing", "rent", "mortgage", "landlord", "hoa")
                .category("Utilities", "electric", "electricity", "water bill", "gas bill", "internet", "utility", "phone bill")
                .category("Groceries", "grocery", "groceries", "supermarket", "whole foods", "trader joe's", "safeway", "kroger", "aldi")
                .category("Dining", "restaurant", "cafe", "coffee", "starbucks", "pizza", "uber eats", "doordash", "grubhub")
                .category("Transportation", "uber", "lyft", "taxi", "fuel", "gas station", "shell", "chevron", "parking", "transit")
                .category("Entertainment", "netflix", "spotify", "hulu", "cinema", "movie", "concert")
                .category("Shopping", "amazon", "target", "walmart", "best buy", "ebay")
                .category("Health", "pharmacy", "cvs", "walgreens", "doctor", "dental", "gym")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<CategoryRule> rules() {
        return rules;
    }

	/**
	 * @return declared category names in match order, without the default category
	 */
    public List<String> categoryNames() {
        return rules.stream().map(CategoryRule::category).toList();
    }

	/**
	 * @return ordered copy of the table as plain category to keyword lists
	 */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (CategoryRule rule : rules) {
            copy.put(rule.category(), rule.keywords().stream().map(Keyword::phrase).toList());
        }
        return Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "KeywordTable" + asMap();
    }

    /**
     * One category and its keywords in declared order.
     */
    public record CategoryRule(String category, List<Keyword> keywords) {
        public CategoryRule {
            keywords = List.copyOf(keywords);
        }
    }

    /**
     * A lower-cased keyword phrase and the pattern that finds it as a whole word or phrase.
     */
    public record Keyword(String phrase, Pattern pattern) {
    }

    /**
     * Collects categories in declaration order. Re-declaring a category appends to its keyword list
     * without moving it.
     */
    public static final class Builder {

        private final Map<String, List<String>> categories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder category(String name, String... keywords) {
            return category(name, List.of(keywords));
        }

        public Builder category(String name, List<String> keywords) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Category name must not be blank.");
            }
            List<String> target = categories.computeIfAbsent(name.trim(), key -> new ArrayList<>());
            if (keywords == null) {
                return this;
            }
            for (String keyword : keywords) {
                if (keyword == null || keyword.isBlank()) {
                    throw new IllegalArgumentException("Category '" + name + "' declares a blank keyword.");
                }
                String normalized = keyword.trim().toLowerCase(Locale.ROOT);
                if (!target.contains(normalized)) {
                    target.add(normalized);
                }
            }
            return this;
        }

        public KeywordTable build() {
            List<CategoryRule> rules = new ArrayList<>(categories.size());
            categories.forEach((name, keywords) -> rules.add(new CategoryRule(name, keywords.stream()
                    .map(phrase -> new Keyword(phrase, KeywordMatcher.phrasePattern(phrase)))
                    .toList())));
            return new KeywordTable(rules);
        }
    }
}
