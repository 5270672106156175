package com.example.wheelcodereader.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityTest {

    @Test
    void identicalTextsAreFullySimilar() {
        assertThat(TextSimilarity.similarity("AT64202", "AT64202")).isEqualTo(1.0);
        assertThat(TextSimilarity.similarity("", "")).isEqualTo(1.0);
    }

    @Test
    void similarityIsNormalizedByTheLongerText() {
        assertThat(TextSimilarity.similarity("AT64202", "AT64203")).isCloseTo(6.0 / 7.0, within(1e-9));
        assertThat(TextSimilarity.similarity("AT6420", "AT64202")).isCloseTo(6.0 / 7.0, within(1e-9));
        assertThat(TextSimilarity.similarity("ABC", "")).isEqualTo(0.0);
    }

    @Test
    void computesLevenshteinDistance() {
        assertThat(TextSimilarity.levenshteinDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(TextSimilarity.levenshteinDistance("", "abc")).isEqualTo(3);
    }

    @Test
    void compactRemovesSpacesAndUpperCases() {
        assertThat(TextSimilarity.compact("at 642 02")).isEqualTo("AT64202");
    }

    @Test
    void detectsAllDigitTexts() {
        assertThat(TextSimilarity.isAllDigits("12345678")).isTrue();
        assertThat(TextSimilarity.isAllDigits("1234A")).isFalse();
        assertThat(TextSimilarity.isAllDigits("")).isFalse();
    }
}
