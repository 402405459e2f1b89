package com.example.identity_resolution_engine.model;

import lombok.Value;

/**
 * 两个姓名之间的一次比对结果，每次比对新建，不可修改。
 */
@Value
public class MatchResult {

    private static final MatchResult NO_MATCH = new MatchResult(false, 0, MatchType.NO_MATCH);

    boolean matches;
    /** 置信度，取值0-100 */
    int confidence;
    MatchType matchType;

    public static MatchResult of(int confidence, MatchType matchType) {
        return new MatchResult(true, confidence, matchType);
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }
}
