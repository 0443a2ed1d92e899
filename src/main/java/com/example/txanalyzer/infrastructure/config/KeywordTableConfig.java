package com.example.txanalyzer.infrastructure.config;

import com.example.txanalyzer.domain.model.KeywordTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single, read-only {@link KeywordTable} shared by every pipeline run.
 */
@Configuration
public class KeywordTableConfig {

    private static final Logger log = LoggerFactory.getLogger(KeywordTableConfig.class);

    @Bean
    public KeywordTable keywordTable(AnalyzerProperties properties) {
        if (properties.getCategories() == null || properties.getCategories().isEmpty()) {
            KeywordTable defaults = KeywordTable.defaults();
            log.info("No analyzer.categories configured; using {} built-in categories.", defaults.categoryNames().size());
            return defaults;
        }
        KeywordTable table = KeywordTable.of(properties.getCategories());
        log.info("Loaded keyword table with categories {}.", table.categoryNames());
        return table;
    }
}
