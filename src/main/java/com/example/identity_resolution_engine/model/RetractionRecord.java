package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 撤稿数据库中的一条记录（由调用方查询后传入）
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetractionRecord {
    private String recordId;
    private String title;
    /** 作者字符串，以分号或逗号分隔 */
    private String authors;
    private String journal;
    private String institution;
    private String retractionDate;
    private String doi;
    private String retractionNature;
    private List<String> reasons = new ArrayList<>();
}
