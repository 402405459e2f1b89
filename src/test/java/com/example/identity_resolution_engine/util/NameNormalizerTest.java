package com.example.identity_resolution_engine.util;

import com.example.identity_resolution_engine.model.NameParts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 姓名规范化测试
 */
public class NameNormalizerTest {

    @Test
    public void testLastCommaFirstIsReordered() {
        NameParts parts = NameNormalizer.normalize("Smith, John Robert");

        assertThat(parts.getFirst()).isEqualTo("john");
        assertThat(parts.getMiddle()).isEqualTo("robert");
        assertThat(parts.getLast()).isEqualTo("smith");
        assertThat(parts.getFull()).isEqualTo("john robert smith");
    }

    @Test
    public void testHonorificsAndDiacriticsAreStripped() {
        NameParts parts = NameNormalizer.normalize("Prof. José Müller, PhD");

        // 逗号后面是 "PhD"，会先被当作名字调到前面，随后作为称谓去掉
        assertThat(parts.getFull()).isEqualTo("jose muller");
        assertThat(parts.getFirst()).isEqualTo("jose");
        assertThat(parts.getLast()).isEqualTo("muller");
    }

    @Test
    public void testNormalizeFull() {
        assertThat(NameNormalizer.normalizeFull("Dr. Forest  Rohwer")).isEqualTo("forest rohwer");
        assertThat(NameNormalizer.normalizeFull("Rohwer, Forest")).isEqualTo("forest rohwer");
        assertThat(NameNormalizer.normalizeFull(null)).isEmpty();
        assertThat(NameNormalizer.normalizeFull("   ")).isEmpty();
    }

    @Test
    public void testSingleTokenIsLastNameOnly() {
        NameParts parts = NameNormalizer.normalize("Harcombe");

        assertThat(parts.hasFirst()).isFalse();
        assertThat(parts.getLast()).isEqualTo("harcombe");
        assertThat(parts.tokenCount()).isEqualTo(1);
    }

    @Test
    public void testInitialsLoseTheirDots() {
        NameParts parts = NameNormalizer.normalize("J. Smith");

        assertThat(parts.getFirst()).isEqualTo("j");
        assertThat(parts.getLast()).isEqualTo("smith");
    }

    @Test
    public void testNullAndBlankYieldEmptyParts() {
        assertThat(NameNormalizer.normalize(null)).isEqualTo(NameParts.EMPTY);
        assertThat(NameNormalizer.normalize("   ")).isEqualTo(NameParts.EMPTY);
        assertThat(NameNormalizer.normalize("Dr.")).isEqualTo(NameParts.EMPTY);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "John Smith", "Smith, John", "Dr. Jane Q. Public", "Prof. José Müller, PhD",
            "M.D. Anderson", "  wei   ZHANG ", "O'Brien-Smith, Mary", "Mrs Ms Mr", "Łukasz Żółć",
            "van der Berg, Anna", "Sir Tim Berners-Lee", "a", ""
    })
    public void testNormalizeIsIdempotent(String raw) {
        NameParts once = NameNormalizer.normalize(raw);
        NameParts twice = NameNormalizer.normalize(once.getFull());

        assertThat(twice).isEqualTo(once);
    }

    @Test
    public void testStripLeadingTitleKeepsCase() {
        assertThat(NameNormalizer.stripLeadingTitle("Dr. Mya Breitbart")).isEqualTo("Mya Breitbart");
        assertThat(NameNormalizer.stripLeadingTitle("Professor Forest Rohwer")).isEqualTo("Forest Rohwer");
        assertThat(NameNormalizer.stripLeadingTitle("Drew Smith")).isEqualTo("Drew Smith");
    }
}
