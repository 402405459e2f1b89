package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.model.RetractionMatch;
import com.example.identity_resolution_engine.model.RetractionRecord;

import java.util.List;

/**
 * 撤稿记录筛查业务接口
 */
public interface IntegrityScreeningService {

    /**
     * 在调用方查出的撤稿记录中查找与目标研究者匹配的作者
     * @param name 研究者姓名
     * @param institution 研究者所在机构，可为空
     * @param records 撤稿记录
     * @return 按置信度降序排列的命中记录
     */
    List<RetractionMatch> screen(String name, String institution, List<RetractionRecord> records);
}
