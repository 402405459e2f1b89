package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 姓名匹配层级标签，序列化时输出下划线形式的标签。
 */
public enum MatchType {
    EXACT("exact"),
    FIRST_LAST_EXACT("first_last_exact"),
    NAME_VARIANT("name_variant"),
    LAST_FIRST_INITIAL("last_first_initial"),
    NAME_ORDER_SWAP("name_order_swap"),
    HIGH_SIMILARITY("high_similarity"),
    FULL_SIMILARITY("full_similarity"),
    NAME_ORDER_SWAP_VARIANT("name_order_swap_variant"),
    PARTIAL_FIRST("partial_first"),
    LAST_NAME_ONLY("last_name_only"),
    NO_MATCH("no_match");

    private final String label;

    MatchType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
