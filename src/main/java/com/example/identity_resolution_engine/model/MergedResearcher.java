package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 同一研究者的多条提及合并后的结果。
 * hIndex/totalCitations取组内最大值，sources取并集，字符串字段取最长的非空值。
 */
@Data
public class MergedResearcher {
    private Long id;
    private String name;
    private String normalizedName;
    private String affiliation;
    private String email;
    private String website;

    @JsonProperty("hIndex")
    private int hIndex;

    private long totalCitations;
    private Set<String> sources = new LinkedHashSet<>();
    private List<Publication> publications = new ArrayList<>();
    private Set<String> keywords = new LinkedHashSet<>();
    private String claudeReason;
    private boolean claudeSuggested;

    // 排序阶段写入
    private Double relevanceScore;
}
