package com.example.identity_resolution_engine.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 声称的专业方向与论文内容的比对结果
 */
@Value
public class ExpertiseMismatchResult {
    boolean mismatch;
    /** 从声称方向中提取的非通用术语 */
    List<String> claimedTerms;
    /** 在论文标题/摘要中命中的术语 */
    List<String> matchedTerms;

    public static ExpertiseMismatchResult none() {
        return new ExpertiseMismatchResult(false, Collections.emptyList(), Collections.emptyList());
    }
}
