package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 来自单一数据源的一条研究者提及记录，由上游检索按命中逐条创建，去重合并时消费。
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Candidate {
    private String name;
    private String affiliation;
    private String email;
    private String website;

    @JsonProperty("hIndex")
    private Integer hIndex;

    private Integer citations;
    private List<Publication> publications = new ArrayList<>();

    // pubmed / arxiv / biorxiv / chemrxiv / scholar / claude
    private String source;

    private String claudeReason;
    private List<String> keywords = new ArrayList<>();

    public Candidate(String name, String affiliation, String source) {
        this.name = name;
        this.affiliation = affiliation;
        this.source = source;
    }
}
