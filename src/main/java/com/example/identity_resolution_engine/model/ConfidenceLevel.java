package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 置信度等级：high >= 90，medium >= 70，low >= 50，其余为insufficient。
 */
public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    INSUFFICIENT("insufficient");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static ConfidenceLevel of(int confidence) {
        if (confidence >= 90) return HIGH;
        if (confidence >= 70) return MEDIUM;
        if (confidence >= 50) return LOW;
        return INSUFFICIENT;
    }
}
