package com.example.identity_resolution_engine.model;

import lombok.Data;

@Data
public class RetractionMatch {
    private RetractionRecord record;
    private String matchedAuthor;
    private int confidence;
    private ConfidenceLevel confidenceLevel;
    private MatchType matchType;
    // 常见姓名误报风险高，需人工复核
    private boolean commonName;
}
