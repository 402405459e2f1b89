package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 论文作者条目（来自文献检索结果）
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Author {
    private String name;
    private String affiliation;
    private List<String> allAffiliations = new ArrayList<>();

    public Author(String name, String affiliation) {
        this.name = name;
        this.affiliation = affiliation;
        if (affiliation != null) {
            this.allAffiliations.add(affiliation);
        }
    }
}
