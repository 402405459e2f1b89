package com.example.identity_resolution_engine.matcher;

import com.example.identity_resolution_engine.model.MatchType;
import com.example.identity_resolution_engine.util.NameNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 规则表单条规则测试，不经过优先级顺序
 */
public class NameMatchRulesTest {

    private static NamePair pair(String a, String b) {
        return new NamePair(NameNormalizer.normalize(a), NameNormalizer.normalize(b));
    }

    private static NameMatchRule rule(MatchType type) {
        return NameMatchRules.DEFAULT.stream()
                .filter(r -> r.getMatchType() == type)
                .findFirst()
                .orElseThrow();
    }

    @Test
    public void testRulesAreOrderedByDescendingConfidence() {
        List<Integer> confidences = NameMatchRules.DEFAULT.stream()
                .map(NameMatchRule::getConfidence)
                .collect(Collectors.toList());

        assertThat(confidences).isSortedAccordingTo((a, b) -> b - a);
        assertThat(NameMatchRules.DEFAULT).hasSize(10);
        assertThat(NameMatchRules.DEFAULT.get(0).getMatchType()).isEqualTo(MatchType.EXACT);
        assertThat(NameMatchRules.DEFAULT.get(9).getMatchType()).isEqualTo(MatchType.LAST_NAME_ONLY);
    }

    @Test
    public void testInitialRuleNeedsOneSideToBeAnInitial() {
        NameMatchRule initial = rule(MatchType.LAST_FIRST_INITIAL);

        assertThat(initial.appliesTo(pair("J. Smith", "John Smith"))).isTrue();
        // 首字母相同但都是完整名字，可能是两个人（John 与 James）
        assertThat(initial.appliesTo(pair("James Smith", "John Smith"))).isFalse();
    }

    @Test
    public void testOrderSwapRulesNeedCompleteNamesOnBothSides() {
        assertThat(rule(MatchType.NAME_ORDER_SWAP).appliesTo(pair("Wei Zhang", "Zhang Wei"))).isTrue();
        assertThat(rule(MatchType.NAME_ORDER_SWAP).appliesTo(pair("Zhang", "Zhang Wei"))).isFalse();
        assertThat(rule(MatchType.NAME_ORDER_SWAP_VARIANT).appliesTo(pair("Bob Zhang", "Zhang Robert"))).isTrue();
    }

    @Test
    public void testPartialFirstRule() {
        NameMatchRule partial = rule(MatchType.PARTIAL_FIRST);

        assertThat(partial.appliesTo(pair("Kat Jones", "Katarina Jones"))).isTrue();
        assertThat(partial.appliesTo(pair("Kat Jones", "Katarina Smith"))).isFalse();
    }

    @Test
    public void testLastNameOnlyRuleRejectsConflictingFirstNames() {
        NameMatchRule lastOnly = rule(MatchType.LAST_NAME_ONLY);

        assertThat(lastOnly.appliesTo(pair("Smith", "J Smith"))).isTrue();
        assertThat(lastOnly.appliesTo(pair("Will Harcombe", "Helen Harcombe"))).isFalse();
        // 长度相差超过3
        assertThat(lastOnly.appliesTo(pair("Smith", "John Smith"))).isFalse();
    }

    @Test
    public void testSimilarityIsComputedOnce() {
        NamePair p = pair("Christophe Vandenberghe", "Christoph Vandenberghe");

        double first = p.fullSimilarity();
        assertThat(p.fullSimilarity()).isEqualTo(first);
        assertThat(first).isGreaterThan(0.9);
    }
}
