package com.example.identity_resolution_engine.matcher;

import com.example.identity_resolution_engine.model.MatchResult;
import com.example.identity_resolution_engine.model.MatchType;
import lombok.Getter;

import java.util.function.Predicate;

/**
 * 姓名匹配层级规则：条件、置信度与标签。
 */
@Getter
public final class NameMatchRule {

    private final String tier;
    private final int confidence;
    private final MatchType matchType;
    private final Predicate<NamePair> condition;

    public NameMatchRule(String tier, int confidence, MatchType matchType, Predicate<NamePair> condition) {
        this.tier = tier;
        this.confidence = confidence;
        this.matchType = matchType;
        this.condition = condition;
    }

    public boolean appliesTo(NamePair pair) {
        return condition.test(pair);
    }

    public MatchResult toResult() {
        return MatchResult.of(confidence, matchType);
    }

    @Override
    public String toString() {
        return "tier " + tier + " (" + matchType + ", " + confidence + ")";
    }
}
