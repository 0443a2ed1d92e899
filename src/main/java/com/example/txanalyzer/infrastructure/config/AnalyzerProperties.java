package com.example.txanalyzer.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyzer settings bound from {@code application.yml}.
 */
@Component
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    /**
     * Category name to keywords, matched in the order written.
     * Empty means the built-in table is used.
     */
    private Map<String, List<String>> categories = new LinkedHashMap<>();

    /**
     * Number of largest outflows listed in a report.
     */
    private int topExpensesLimit = 5;

    /**
     * CSV export analyzed on startup; leave unset to run only the HTTP API.
     */
    private String inputFile;

    public Map<String, List<String>> getCategories() {
        return categories;
    }

    public void setCategories(Map<String, List<String>> categories) {
        this.categories = categories;
    }

    public int getTopExpensesLimit() {
        return topExpensesLimit;
    }

    public void setTopExpensesLimit(int topExpensesLimit) {
        this.topExpensesLimit = topExpensesLimit;
    }

    public String getInputFile() {
        return inputFile;
    }

    public void setInputFile(String inputFile) {
        this.inputFile = inputFile;
    }
}
