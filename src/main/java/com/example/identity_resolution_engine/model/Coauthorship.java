package com.example.identity_resolution_engine.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 候选人与另一位作者之间的合著记录
 */
@Data
public class Coauthorship {
    private String otherName;
    private int paperCount;
    // 最多保留3篇
    private List<Publication> samplePapers = new ArrayList<>();
}
