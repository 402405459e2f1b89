package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Publication {

    private String title;

    private Integer year;

    private List<Author> authors = new ArrayList<>();

    private String journal;

    private String doi;

    private String pmid;

    // 外部数据中的字段名为abstract
    @JsonProperty("abstract")
    private String abstractText;

    /**
     * 标题与摘要拼接后的小写文本，用于关键词命中判断
     */
    @JsonIgnore
    public String getSearchText() {
        String t = title == null ? "" : title;
        String a = abstractText == null ? "" : abstractText;
        return (t + " " + a).toLowerCase();
    }

    @JsonIgnore
    public String getUrl() {
        if (pmid != null) {
            return "https://pubmed.ncbi.nlm.nih.gov/" + pmid;
        }
        return doi != null ? "https://doi.org/" + doi : null;
    }
}
