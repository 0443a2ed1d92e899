package com.example.txanalyzer.domain.service;

import com.example.txanalyzer.domain.model.CategoryMatch;
import com.example.txanalyzer.domain.model.KeywordTable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the whole-phrase keyword matching rules.
 */
class KeywordMatcherTest {

    private final KeywordTable table = KeywordTable.builder()
            .category("Housing", "rent", "mortgage")
            .category("Dining", "uber eats", "cafe")
            .category("Transportation", "uber", "parking")
            .build();

    @Test
    void keywordDoesNotMatchInsideLongerWord() {
        assertThat(KeywordMatcher.categorize("a different plan", table)).isEqualTo(KeywordTable.UNCATEGORIZED);
        assertThat(KeywordMatcher.categorize("Parental leave", table)).isEqualTo(KeywordTable.UNCATEGORIZED);
    }

    @Test
    void keywordMatchesAsWholeWord() {
        assertThat(KeywordMatcher.categorize("rent due", table)).isEqualTo("Housing");
        assertThat(KeywordMatcher.categorize("March RENT", table)).isEqualTo("Housing");
        assertThat(KeywordMatcher.categorize("rent-payment #42", table)).isEqualTo("Housing");
    }

    @Test
    void digitsCountAsPartOfAWord() {
        assertThat(KeywordMatcher.categorize("rent2024", table)).isEqualTo(KeywordTable.UNCATEGORIZED);
    }

    @Test
    void multiWordPhraseMatchesOnlyAsPhrase() {
        assertThat(KeywordMatcher.match("UBER EATS *ORDER 991", table))
                .isEqualTo(new CategoryMatch("Dining", "uber eats"));
        assertThat(KeywordMatcher.match("Uber trip downtown", table))
                .isEqualTo(new CategoryMatch("Transportation", "uber"));
    }

    /**
     * Two categories declaring the same keyword: the earlier declaration wins, on every run.
     */
    @Test
    void earlierCategoryWinsTies() {
        KeywordTable overlapping = KeywordTable.builder()
                .category("Bills", "payment")
                .category("Housing", "payment", "rent")
                .build();

        for (int run = 0; run < 20; run++) {
            assertThat(KeywordMatcher.categorize("rent payment", overlapping)).isEqualTo("Bills");
        }
    }

    @Test
    void earlierCategoryWinsEvenWhenLaterKeywordAppearsFirstInText() {
        KeywordTable ordered = KeywordTable.builder()
                .category("Shopping", "amazon")
                .category("Entertainment", "prime video")
                .build();

        assertThat(KeywordMatcher.categorize("prime video via amazon", ordered)).isEqualTo("Shopping");
    }

    @Test
    void blankOrMissingDescriptionIsUncategorized() {
        assertThat(KeywordMatcher.match(null, table)).isEqualTo(CategoryMatch.uncategorized());
        assertThat(KeywordMatcher.match("   ", table).matched()).isFalse();
        assertThat(KeywordMatcher.categorize("anything", KeywordTable.empty())).isEqualTo(KeywordTable.UNCATEGORIZED);
    }

    @Test
    void keywordsWithPunctuationAreMatchedLiterally() {
        KeywordTable punctuated = KeywordTable.builder()
                .category("Groceries", "trader joe's")
                .category("Subscriptions", "apple.com/bill")
                .build();

        assertThat(KeywordMatcher.categorize("TRADER JOE'S #552", punctuated)).isEqualTo("Groceries");
        assertThat(KeywordMatcher.categorize("APPLE.COM/BILL 866-712", punctuated)).isEqualTo("Subscriptions");
        assertThat(KeywordMatcher.categorize("applexcom/bill", punctuated)).isEqualTo(KeywordTable.UNCATEGORIZED);
    }
}
