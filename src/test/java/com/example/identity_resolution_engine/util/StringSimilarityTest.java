package com.example.identity_resolution_engine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class StringSimilarityTest {

    @Test
    public void testIdenticalAndDisjointStrings() {
        assertThat(StringSimilarity.compare("john smith", "john smith")).isEqualTo(1.0);
        assertThat(StringSimilarity.compare("abc", "xyz")).isEqualTo(0.0);
    }

    @Test
    public void testWhitespaceIsIgnored() {
        assertThat(StringSimilarity.compare("john smith", "johnsmith")).isEqualTo(1.0);
    }

    @Test
    public void testBigramDiceCoefficient() {
        // night/nacht 共享 "ht" 一个二元组：2*1/(4+4)
        assertThat(StringSimilarity.compare("night", "nacht")).isCloseTo(0.25, within(1e-9));
    }

    @Test
    public void testShortAndNullInputs() {
        assertThat(StringSimilarity.compare("a", "b")).isEqualTo(0.0);
        assertThat(StringSimilarity.compare(null, "b")).isEqualTo(0.0);
    }
}
